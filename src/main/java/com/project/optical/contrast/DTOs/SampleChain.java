package com.project.optical.contrast.DTOs;

import com.project.optical.contrast.exceptions.InsufficientPointsException;

import java.util.ArrayList;
import java.util.List;

/**
 * One line cut: an ordered, non-empty run of segments. Profiles of the
 * segments are concatenated in this order.
 */
public record SampleChain(List<Segment> segments) {

    public SampleChain {
        if (segments == null || segments.isEmpty()) {
            throw new InsufficientPointsException("A line cut needs at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public static SampleChain of(Segment... segments) {
        return new SampleChain(List.of(segments));
    }

    /** Builds consecutive segments p0-p1, p1-p2, ... from a drawn poly-line. */
    public static SampleChain fromPolyline(List<Point> points) {
        if (points == null || points.size() < 2) {
            throw new InsufficientPointsException(
                    "A line cut needs at least 2 points (received: " + (points == null ? 0 : points.size()) + ")");
        }
        List<Segment> segments = new ArrayList<>(points.size() - 1);
        for (int i = 0; i < points.size() - 1; i++) {
            segments.add(new Segment(points.get(i), points.get(i + 1)));
        }
        return new SampleChain(segments);
    }

    public int size() {
        return segments.size();
    }
}
