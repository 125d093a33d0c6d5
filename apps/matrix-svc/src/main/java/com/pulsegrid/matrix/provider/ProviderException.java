package com.pulsegrid.matrix.provider;

/**
 * The time-series provider failed or returned an incomplete response. Fatal for the run.
 */
public class ProviderException extends RuntimeException {

    private final String segmentPair;
    private final String metricId;

    public ProviderException(String segmentPair, String metricId, String message, Throwable cause) {
        super(message, cause);
        this.segmentPair = segmentPair;
        this.metricId = metricId;
    }

    public ProviderException(String segmentPair, String message, Throwable cause) {
        this(segmentPair, null, message, cause);
    }

    public static ProviderException missingSeries(String segmentPair, String metricId) {
        return new ProviderException(segmentPair, metricId,
                "Provider response for " + segmentPair + " is missing series for metric '" + metricId + "'", null);
    }

    public static ProviderException duplicateDay(String segmentPair, String metricId, Object date) {
        return new ProviderException(segmentPair, metricId,
                "Provider response for " + segmentPair + " repeats " + date + " in series for metric '" + metricId + "'", null);
    }

    public String segmentPair() {
        return segmentPair;
    }

    public String metricId() {
        return metricId;
    }
}
