package com.pulsegrid.matrix.analytics;

import com.pulsegrid.matrix.model.AssessmentWindow;
import com.pulsegrid.matrix.model.Classification;
import com.pulsegrid.matrix.model.DayRecord;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.Polarity;
import com.pulsegrid.matrix.model.SeriesTally;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Folds one metric's per-day series into good/bad anomaly counts. Days outside the
 * assessment window are trend context only and are never counted; a date is counted at most once.
 */
@Component
public class SeriesAggregator {

    private final DayClassifier dayClassifier;
    private final MetricPolarityRegistry polarityRegistry;

    public SeriesAggregator(DayClassifier dayClassifier, MetricPolarityRegistry polarityRegistry) {
        this.dayClassifier = dayClassifier;
        this.polarityRegistry = polarityRegistry;
    }

    public SeriesTally aggregate(List<DayRecord> days, Metric metric, boolean includeWeekends, AssessmentWindow window) {
        Polarity polarity = polarityRegistry.polarity(metric);
        SeriesTally tally = SeriesTally.EMPTY;
        if (days == null) {
            return tally;
        }
        Set<LocalDate> counted = new HashSet<>();
        for (DayRecord day : days) {
            if (day == null || !window.contains(day.date()) || !counted.add(day.date())) {
                continue;
            }
            Classification classification = dayClassifier.classify(day, polarity, includeWeekends);
            boolean gap = classification != Classification.EXCLUDED_WEEKEND && !day.hasActualAndBounds();
            tally = tally.plus(classification, gap);
        }
        return tally;
    }
}
