package com.pulsegrid.matrix.model;

/**
 * Reported metric. A null polarity means the metric has not been registered yet.
 */
public record Metric(
        String id,
        String name,
        Polarity polarity,
        Format format,
        int decimals
) {
    public Metric {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("metric id must be provided");
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative for metric " + id);
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (format == null) {
            format = Format.DECIMAL;
        }
    }

    public enum Format {
        DECIMAL,
        PERCENT,
        CURRENCY,
        TIME
    }
}
