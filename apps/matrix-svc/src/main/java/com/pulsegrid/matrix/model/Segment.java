package com.pulsegrid.matrix.model;

public record Segment(String id, String name, int ordinal) {
    public Segment {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("segment id must be provided");
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must not be negative");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
    }
}
