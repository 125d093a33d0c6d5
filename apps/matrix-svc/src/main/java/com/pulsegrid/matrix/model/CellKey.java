package com.pulsegrid.matrix.model;

public record CellKey(String segmentAId, String segmentBId, String metricId) {
    public CellKey {
        if (segmentAId == null || segmentBId == null || metricId == null) {
            throw new IllegalArgumentException("cell key components must be provided");
        }
    }

    @Override
    public String toString() {
        return segmentAId + " x " + segmentBId + " / " + metricId;
    }
}
