package com.pulsegrid.matrix.model;

public record CellResult(
        String segmentAId,
        String segmentBId,
        String metricId,
        int good,
        int bad,
        int net
) {
    public CellResult {
        if (segmentAId == null || segmentBId == null || metricId == null) {
            throw new IllegalArgumentException("cell key components must be provided");
        }
        if (good < 0 || bad < 0) {
            throw new IllegalArgumentException("anomaly counts must not be negative");
        }
        if (net != good - bad) {
            throw new IllegalArgumentException("net must equal good - bad for " + segmentAId + "/" + segmentBId + "/" + metricId);
        }
    }

    public static CellResult of(Segment segmentA, Segment segmentB, Metric metric, SeriesTally tally) {
        return new CellResult(segmentA.id(), segmentB.id(), metric.id(), tally.good(), tally.bad(), tally.net());
    }

    public CellKey key() {
        return new CellKey(segmentAId, segmentBId, metricId);
    }
}
