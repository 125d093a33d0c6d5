package com.pulsegrid.matrix.controller.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record AnomalyMatrixResponseDto(
        LocalDate windowStart,
        LocalDate windowEnd,
        boolean includeWeekends,
        Instant generatedAt,
        List<SegmentView> rows,
        List<SegmentView> columns,
        List<MetricView> metrics,
        List<Cell> cells,
        String traceId
) {
    public record SegmentView(String id, String name, int ordinal) {
    }

    public record MetricView(String id, String name, String polarity, String format, int decimals) {
    }

    public record Cell(String segmentA, String segmentB, String metric, int good, int bad, int net) {
    }
}
