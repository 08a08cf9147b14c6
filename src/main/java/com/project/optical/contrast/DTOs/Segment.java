package com.project.optical.contrast.DTOs;

import java.util.Objects;

/**
 * Directed line between two pixels. Direction only affects the order of the
 * sampled values, never the values themselves.
 */
public record Segment(Point start, Point end) {

    public Segment {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static Segment of(int x1, int y1, int x2, int y2) {
        return new Segment(new Point(x1, y1), new Point(x2, y2));
    }

    public boolean isDegenerate() {
        return start.equals(end);
    }

    public Segment reversed() {
        return new Segment(end, start);
    }
}
