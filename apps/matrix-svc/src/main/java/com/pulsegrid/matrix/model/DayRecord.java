package com.pulsegrid.matrix.model;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * One metric's values for a single day. Any value may be null when the provider had no data.
 */
public record DayRecord(
        LocalDate date,
        Double actual,
        Double forecast,
        Double upper,
        Double lower
) {
    public DayRecord {
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
    }

    public boolean isWeekend() {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public boolean hasActualAndBounds() {
        return isFinite(actual) && isFinite(upper) && isFinite(lower);
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }
}
