package com.pulsegrid.matrix.model;

import java.time.LocalDate;

/**
 * Inclusive date range whose days are counted towards anomaly totals.
 */
public record AssessmentWindow(LocalDate start, LocalDate end) {
    public AssessmentWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("assessment window start and end must be provided");
        }
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean isWellFormed() {
        return start.isBefore(end);
    }

    public LocalDate trendStart(int trendDays) {
        return start.minusDays(trendDays);
    }
}
