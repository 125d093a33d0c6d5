package com.pulsegrid.matrix.model;

/**
 * Counts for one metric over one segment pair's assessment window.
 */
public record SeriesTally(int good, int bad, int excluded, int dataGaps) {

    public static final SeriesTally EMPTY = new SeriesTally(0, 0, 0, 0);

    public int net() {
        return good - bad;
    }

    public SeriesTally plus(Classification classification, boolean dataGap) {
        return new SeriesTally(
                good + (classification == Classification.GOOD_ANOMALY ? 1 : 0),
                bad + (classification == Classification.BAD_ANOMALY ? 1 : 0),
                excluded + (classification == Classification.EXCLUDED_WEEKEND ? 1 : 0),
                dataGaps + (dataGap ? 1 : 0)
        );
    }
}
