package com.pulsegrid.matrix.model;

public enum Polarity {
    HIGHER_IS_GOOD,
    HIGHER_IS_BAD
}
