package com.pulsegrid.matrix.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of cell results for one report run, unique on (segment A, segment B, metric).
 * Keeps the declared segment and metric order so a renderer can lay out rows and columns.
 */
public final class AnomalyMatrix {

    private final List<Segment> segmentsA;
    private final List<Segment> segmentsB;
    private final List<Metric> metrics;
    private final AssessmentWindow window;
    private final boolean includeWeekends;
    private final Instant generatedAt;
    private final Map<CellKey, CellResult> cells;

    private AnomalyMatrix(
            List<Segment> segmentsA,
            List<Segment> segmentsB,
            List<Metric> metrics,
            AssessmentWindow window,
            boolean includeWeekends,
            Instant generatedAt,
            Map<CellKey, CellResult> cells
    ) {
        this.segmentsA = List.copyOf(segmentsA);
        this.segmentsB = List.copyOf(segmentsB);
        this.metrics = List.copyOf(metrics);
        this.window = window;
        this.includeWeekends = includeWeekends;
        this.generatedAt = generatedAt;
        this.cells = Collections.unmodifiableMap(cells);
    }

    public static AnomalyMatrix of(
            List<Segment> segmentsA,
            List<Segment> segmentsB,
            List<Metric> metrics,
            AssessmentWindow window,
            boolean includeWeekends,
            Instant generatedAt,
            Collection<CellResult> results
    ) {
        Map<CellKey, CellResult> indexed = new LinkedHashMap<>();
        for (CellResult result : results) {
            CellResult previous = indexed.putIfAbsent(result.key(), result);
            if (previous != null) {
                throw new IllegalStateException("Duplicate cell result for " + result.key());
            }
        }
        return new AnomalyMatrix(segmentsA, segmentsB, metrics, window, includeWeekends, generatedAt, indexed);
    }

    public Optional<CellResult> cell(String segmentAId, String segmentBId, String metricId) {
        return Optional.ofNullable(cells.get(new CellKey(segmentAId, segmentBId, metricId)));
    }

    public List<CellResult> cells() {
        return List.copyOf(cells.values());
    }

    public int size() {
        return cells.size();
    }

    /**
     * True when every (segment A, segment B, metric) combination has exactly one result.
     */
    public boolean isComplete() {
        if (cells.size() != segmentsA.size() * segmentsB.size() * metrics.size()) {
            return false;
        }
        for (Segment a : segmentsA) {
            for (Segment b : segmentsB) {
                for (Metric metric : metrics) {
                    if (!cells.containsKey(new CellKey(a.id(), b.id(), metric.id()))) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    public List<Segment> segmentsA() {
        return segmentsA;
    }

    public List<Segment> segmentsB() {
        return segmentsB;
    }

    public List<Metric> metrics() {
        return metrics;
    }

    public AssessmentWindow window() {
        return window;
    }

    public boolean includeWeekends() {
        return includeWeekends;
    }

    public Instant generatedAt() {
        return generatedAt;
    }
}
