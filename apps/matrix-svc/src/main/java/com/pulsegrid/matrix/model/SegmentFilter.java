package com.pulsegrid.matrix.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Effective filter for one matrix cell: the base filter AND segment A AND segment B.
 */
public record SegmentFilter(String baseFilter, Segment segmentA, Segment segmentB) {

    public List<String> segmentIds() {
        List<String> ids = new ArrayList<>(3);
        if (baseFilter != null && !baseFilter.isBlank()) {
            ids.add(baseFilter);
        }
        ids.add(segmentA.id());
        ids.add(segmentB.id());
        return List.copyOf(ids);
    }

    public String describe() {
        return String.join(" AND ", segmentIds());
    }
}
