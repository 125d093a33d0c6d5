package com.pulsegrid.matrix.model;

public enum Classification {
    NO_ANOMALY,
    GOOD_ANOMALY,
    BAD_ANOMALY,
    EXCLUDED_WEEKEND
}
