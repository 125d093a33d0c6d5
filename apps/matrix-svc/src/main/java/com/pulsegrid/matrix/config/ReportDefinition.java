package com.pulsegrid.matrix.config;

import com.pulsegrid.matrix.model.AssessmentWindow;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.Segment;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

/**
 * Validated, immutable view of the report configuration used by a matrix run.
 */
public record ReportDefinition(
        List<Segment> segmentsA,
        List<Segment> segmentsB,
        List<Metric> metrics,
        String baseSegmentFilter,
        AssessmentWindow window,
        boolean includeWeekends,
        int trendDays,
        int parallelism
) {
    public ReportDefinition {
        segmentsA = List.copyOf(segmentsA);
        segmentsB = List.copyOf(segmentsB);
        metrics = List.copyOf(metrics);
    }

    public static ReportDefinition from(PulsegridProperties properties) {
        PulsegridProperties.Report report = properties.report();
        AssessmentWindow window = report.window();
        if (!window.isWellFormed()) {
            throw new ConfigurationException("pulsegrid.report.assessment-start",
                    "Assessment window start " + window.start() + " must be before end " + window.end());
        }
        return new ReportDefinition(
                toSegments("pulsegrid.segments-a", properties.segmentsA()),
                toSegments("pulsegrid.segments-b", properties.segmentsB()),
                toMetrics(properties.metrics()),
                report.hasBaseSegmentFilter() ? report.baseSegmentFilter().trim() : null,
                window,
                report.includeWeekendsFlag(),
                report.trendDaysOrDefault(),
                report.parallelismOrDefault()
        );
    }

    /**
     * Identifies the inputs that shape a matrix; a persisted snapshot is only reused when it matches.
     */
    public String fingerprint() {
        StringBuilder source = new StringBuilder();
        source.append(window.start()).append('|').append(window.end())
                .append("|weekends=").append(includeWeekends)
                .append("|base=").append(baseSegmentFilter == null ? "" : baseSegmentFilter)
                .append("|a=");
        segmentsA.forEach(segment -> source.append(segment.id()).append(','));
        source.append("|b=");
        segmentsB.forEach(segment -> source.append(segment.id()).append(','));
        source.append("|m=");
        metrics.forEach(metric -> source.append(metric.id()).append(':').append(metric.polarity()).append(','));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(source.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public int cellCount() {
        return segmentsA.size() * segmentsB.size() * metrics.size();
    }

    private static List<Segment> toSegments(String key, List<PulsegridProperties.SegmentEntry> entries) {
        if (entries.isEmpty()) {
            throw new ConfigurationException(key, "Segment list must not be empty");
        }
        List<Segment> segments = new ArrayList<>(entries.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            PulsegridProperties.SegmentEntry entry = entries.get(i);
            String entryKey = key + "[" + i + "].id";
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                throw new ConfigurationException(entryKey, "Segment id must be provided");
            }
            if (!seen.add(entry.id())) {
                throw new ConfigurationException(entryKey, "Duplicate segment id '" + entry.id() + "'");
            }
            segments.add(new Segment(entry.id(), entry.name(), i));
        }
        return segments;
    }

    private static List<Metric> toMetrics(List<PulsegridProperties.MetricEntry> entries) {
        if (entries.isEmpty()) {
            throw new ConfigurationException("pulsegrid.metrics", "Metric list must not be empty");
        }
        List<Metric> metrics = new ArrayList<>(entries.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            PulsegridProperties.MetricEntry entry = entries.get(i);
            String entryKey = "pulsegrid.metrics[" + i + "]";
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                throw new ConfigurationException(entryKey + ".id", "Metric id must be provided");
            }
            if (!seen.add(entry.id())) {
                throw new ConfigurationException(entryKey + ".id", "Duplicate metric id '" + entry.id() + "'");
            }
            if (entry.polarity() == null) {
                throw new ConfigurationException(entryKey + ".polarity",
                        "No polarity configured for metric '" + entry.id() + "'");
            }
            if (entry.decimals() != null && entry.decimals() < 0) {
                throw new ConfigurationException(entryKey + ".decimals", "Decimals must not be negative");
            }
            metrics.add(new Metric(entry.id(), entry.name(), entry.polarity(), entry.format(),
                    entry.decimals() != null ? entry.decimals() : 0));
        }
        return metrics;
    }
}
