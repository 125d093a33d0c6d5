package com.pulsegrid.matrix.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider response for one segment pair: metric id to its per-day records.
 */
public record SegmentPairSeries(Map<String, List<DayRecord>> series) {
    public SegmentPairSeries {
        series = series == null ? Map.of() : Map.copyOf(series);
    }

    public Optional<List<DayRecord>> forMetric(String metricId) {
        return Optional.ofNullable(series.get(metricId));
    }
}
