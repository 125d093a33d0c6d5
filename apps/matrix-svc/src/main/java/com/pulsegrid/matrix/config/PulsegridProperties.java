package com.pulsegrid.matrix.config;

import com.pulsegrid.matrix.model.AssessmentWindow;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.Polarity;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.format.annotation.DateTimeFormat;

@ConfigurationProperties(prefix = "pulsegrid")
public record PulsegridProperties(
        Report report,
        List<MetricEntry> metrics,
        List<SegmentEntry> segmentsA,
        List<SegmentEntry> segmentsB,
        Provider provider,
        Snapshot snapshot
) {

    @ConstructorBinding
    public PulsegridProperties {
        if (report == null) {
            throw new IllegalArgumentException("report configuration must be provided");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider configuration must be provided");
        }
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        segmentsA = segmentsA == null ? List.of() : List.copyOf(segmentsA);
        segmentsB = segmentsB == null ? List.of() : List.copyOf(segmentsB);
        // empty lists are reported by ReportDefinition with the offending key
    }

    public Snapshot snapshot() {
        return snapshot != null ? snapshot : new Snapshot(null, null, null);
    }

    public record Report(
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate assessmentStart,
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate assessmentEnd,
            Boolean includeWeekends,
            Integer trendDays,
            String baseSegmentFilter,
            Integer parallelism
    ) {
        public Report {
            if (assessmentStart == null) {
                throw new IllegalArgumentException("assessmentStart must be provided");
            }
            if (assessmentEnd == null) {
                throw new IllegalArgumentException("assessmentEnd must be provided");
            }
            if (trendDays != null && trendDays < 0) {
                throw new IllegalArgumentException("trendDays must not be negative");
            }
            if (parallelism != null && parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
        }

        public AssessmentWindow window() {
            return new AssessmentWindow(assessmentStart, assessmentEnd);
        }

        public boolean includeWeekendsFlag() {
            return includeWeekends != null && includeWeekends;
        }

        public int trendDaysOrDefault() {
            return trendDays != null ? trendDays : 35;
        }

        public int parallelismOrDefault() {
            return parallelism != null ? parallelism : 1;
        }

        public boolean hasBaseSegmentFilter() {
            return baseSegmentFilter != null && !baseSegmentFilter.isBlank();
        }
    }

    public record MetricEntry(String id, String name, Polarity polarity, Metric.Format format, Integer decimals) {
    }

    public record SegmentEntry(String id, String name) {
    }

    public record Provider(
            String baseUrl,
            String apiKey,
            String reportSuite,
            Integer lookbackDays,
            Integer connectTimeoutMs,
            Integer readTimeoutMs
    ) {
        public Provider {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must be provided");
            }
            // apiKey is optional for providers running inside the trusted network
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public int lookbackDaysOrDefault() {
            return lookbackDays != null ? lookbackDays : 35;
        }

        public int connectTimeoutMsOrDefault() {
            return connectTimeoutMs != null ? connectTimeoutMs : 10_000;
        }

        public int readTimeoutMsOrDefault() {
            return readTimeoutMs != null ? readTimeoutMs : 60_000;
        }
    }

    public record Snapshot(Boolean enabled, String directory, String fileName) {
        public boolean enabledFlag() {
            return enabled == null || enabled;
        }

        public Path path() {
            String dir = directory != null && !directory.isBlank() ? directory : "snapshots";
            String name = fileName != null && !fileName.isBlank() ? fileName : "anomaly-matrix.json";
            return Path.of(dir).resolve(name);
        }
    }
}
