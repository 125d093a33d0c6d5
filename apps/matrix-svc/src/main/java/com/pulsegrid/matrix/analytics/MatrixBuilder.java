package com.pulsegrid.matrix.analytics;

import com.pulsegrid.matrix.config.ConfigurationException;
import com.pulsegrid.matrix.config.ReportDefinition;
import com.pulsegrid.matrix.model.AnomalyMatrix;
import com.pulsegrid.matrix.model.AssessmentWindow;
import com.pulsegrid.matrix.model.CellResult;
import com.pulsegrid.matrix.model.DayRecord;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.Segment;
import com.pulsegrid.matrix.model.SegmentFilter;
import com.pulsegrid.matrix.model.SegmentPairSeries;
import com.pulsegrid.matrix.model.SeriesTally;
import com.pulsegrid.matrix.provider.ProviderException;
import com.pulsegrid.matrix.provider.TimeSeriesProvider;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Drives segment list A x segment list B x metrics. One provider call per segment pair serves
 * every metric; each pair's cells are collected independently and merged into the matrix at the end.
 */
@Component
public class MatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(MatrixBuilder.class);
    static final String MDC_SEGMENT_PAIR = "segment_pair";

    private final SeriesAggregator seriesAggregator;
    private final MetricPolarityRegistry polarityRegistry;
    private final Clock clock;

    @Autowired
    public MatrixBuilder(SeriesAggregator seriesAggregator, MetricPolarityRegistry polarityRegistry) {
        this(seriesAggregator, polarityRegistry, Clock.systemUTC());
    }

    MatrixBuilder(SeriesAggregator seriesAggregator, MetricPolarityRegistry polarityRegistry, Clock clock) {
        this.seriesAggregator = seriesAggregator;
        this.polarityRegistry = polarityRegistry;
        this.clock = clock;
    }

    public AnomalyMatrix build(ReportDefinition definition, TimeSeriesProvider provider) {
        return build(
                definition.segmentsA(),
                definition.segmentsB(),
                definition.metrics(),
                definition.baseSegmentFilter(),
                new RunOptions(definition.window(), definition.includeWeekends(), definition.trendDays(), definition.parallelism()),
                provider
        );
    }

    public AnomalyMatrix build(
            List<Segment> segmentsA,
            List<Segment> segmentsB,
            List<Metric> metrics,
            String baseSegmentFilter,
            RunOptions options,
            TimeSeriesProvider provider
    ) {
        validate(segmentsA, segmentsB, metrics, options.window());
        long startedAt = System.nanoTime();
        int pairCount = segmentsA.size() * segmentsB.size();
        log.info("Anomaly matrix run started: pairs={}, metrics={}, window={}..{}, includeWeekends={}, parallelism={}",
                pairCount, metrics.size(), options.window().start(), options.window().end(),
                options.includeWeekends(), options.parallelism());

        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        List<Callable<List<CellResult>>> tasks = new ArrayList<>(pairCount);
        for (Segment a : segmentsA) {
            for (Segment b : segmentsB) {
                SegmentFilter filter = new SegmentFilter(baseSegmentFilter, a, b);
                tasks.add(() -> inPairContext(callerContext, filter, () -> buildPair(filter, metrics, options, provider)));
            }
        }

        List<CellResult> results = options.parallelism() > 1 && tasks.size() > 1
                ? runParallel(tasks, options.parallelism())
                : runSequential(tasks);

        AnomalyMatrix matrix = AnomalyMatrix.of(segmentsA, segmentsB, metrics, options.window(),
                options.includeWeekends(), clock.instant(), results);
        log.info("Anomaly matrix run finished: cells={}, elapsedMs={}", matrix.size(), (System.nanoTime() - startedAt) / 1_000_000);
        return matrix;
    }

    /**
     * Runs a pair task with the caller's MDC (trace id) plus {@code segment_pair}, on whichever
     * thread executes it, and restores the thread's previous MDC afterwards.
     */
    private static List<CellResult> inPairContext(
            Map<String, String> callerContext,
            SegmentFilter filter,
            Callable<List<CellResult>> task
    ) throws Exception {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MDC.put(MDC_SEGMENT_PAIR, filter.segmentA().id() + " x " + filter.segmentB().id());
        try {
            return task.call();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    List<CellResult> buildPair(SegmentFilter filter, List<Metric> metrics, RunOptions options, TimeSeriesProvider provider) {
        String pair = filter.segmentA().id() + " x " + filter.segmentB().id();
        AssessmentWindow window = options.window();
        LocalDate fetchStart = window.trendStart(options.trendDays());
        log.debug("Fetching series for {} ({}..{})", pair, fetchStart, window.end());
        SegmentPairSeries series;
        try {
            series = provider.fetch(filter, metrics, fetchStart, window.end(), TimeSeriesProvider.Granularity.DAY);
        } catch (ProviderException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ProviderException(pair, "Time-series provider failed for " + pair + ": " + ex.getMessage(), ex);
        }
        if (series == null) {
            throw new ProviderException(pair, "Time-series provider returned no response for " + pair, null);
        }
        List<CellResult> cells = new ArrayList<>(metrics.size());
        for (Metric metric : metrics) {
            List<DayRecord> days = series.forMetric(metric.id())
                    .orElseThrow(() -> ProviderException.missingSeries(pair, metric.id()));
            requireDistinctDates(pair, metric, days);
            SeriesTally tally = seriesAggregator.aggregate(days, metric, options.includeWeekends(), window);
            if (tally.dataGaps() > 0) {
                log.warn("Data gap: {} day(s) without actual or bounds for {} / {}; counted as no anomaly",
                        tally.dataGaps(), pair, metric.id());
            }
            cells.add(CellResult.of(filter.segmentA(), filter.segmentB(), metric, tally));
        }
        return cells;
    }

    private static void requireDistinctDates(String pair, Metric metric, List<DayRecord> days) {
        Set<LocalDate> seen = new HashSet<>();
        for (DayRecord day : days) {
            if (day != null && !seen.add(day.date())) {
                throw ProviderException.duplicateDay(pair, metric.id(), day.date());
            }
        }
    }

    private List<CellResult> runSequential(List<Callable<List<CellResult>>> tasks) {
        List<CellResult> results = new ArrayList<>();
        for (Callable<List<CellResult>> task : tasks) {
            results.addAll(call(task));
        }
        return results;
    }

    private List<CellResult> runParallel(List<Callable<List<CellResult>>> tasks, int parallelism) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<List<CellResult>>> futures = new ArrayList<>(tasks.size());
            for (Callable<List<CellResult>> task : tasks) {
                futures.add(executor.submit(task));
            }
            List<CellResult> results = new ArrayList<>();
            for (Future<List<CellResult>> future : futures) {
                results.addAll(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private List<CellResult> await(Future<List<CellResult>> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException(null, "Anomaly matrix run interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ProviderException(null, "Anomaly matrix run failed: " + cause, cause);
        }
    }

    private List<CellResult> call(Callable<List<CellResult>> task) {
        try {
            return task.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new ProviderException(null, "Anomaly matrix run failed: " + ex.getMessage(), ex);
        }
    }

    private void validate(List<Segment> segmentsA, List<Segment> segmentsB, List<Metric> metrics, AssessmentWindow window) {
        if (segmentsA == null || segmentsA.isEmpty()) {
            throw new ConfigurationException("pulsegrid.segments-a", "Segment list must not be empty");
        }
        if (segmentsB == null || segmentsB.isEmpty()) {
            throw new ConfigurationException("pulsegrid.segments-b", "Segment list must not be empty");
        }
        if (metrics == null || metrics.isEmpty()) {
            throw new ConfigurationException("pulsegrid.metrics", "Metric list must not be empty");
        }
        if (!window.isWellFormed()) {
            throw new ConfigurationException("pulsegrid.report.assessment-start",
                    "Assessment window start " + window.start() + " must be before end " + window.end());
        }
        polarityRegistry.requireRegistered(metrics);
    }

    public record RunOptions(AssessmentWindow window, boolean includeWeekends, int trendDays, int parallelism) {
        public RunOptions {
            if (window == null) {
                throw new IllegalArgumentException("window must be provided");
            }
            if (trendDays < 0) {
                throw new IllegalArgumentException("trendDays must not be negative");
            }
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
        }

        public static RunOptions sequential(AssessmentWindow window, boolean includeWeekends) {
            return new RunOptions(window, includeWeekends, 0, 1);
        }
    }
}
