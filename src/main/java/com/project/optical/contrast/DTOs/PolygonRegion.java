package com.project.optical.contrast.DTOs;

import com.project.optical.contrast.exceptions.InsufficientPointsException;

import java.util.List;

/**
 * Closed background region. The last vertex connects back to the first, so
 * the first vertex is never repeated.
 */
public record PolygonRegion(List<Point> points) {

    public PolygonRegion {
        if (points == null || points.size() < 3) {
            throw new InsufficientPointsException(
                    "A background region needs at least 3 points (received: " + (points == null ? 0 : points.size()) + ")");
        }
        points = List.copyOf(points);
    }

    public static PolygonRegion of(Point... points) {
        return new PolygonRegion(List.of(points));
    }

    /** Axis-aligned rectangle from two opposite corners, clockwise from {@code corner}. */
    public static PolygonRegion rectangle(Point corner, Point opposite) {
        return new PolygonRegion(List.of(
                new Point(corner.x(), corner.y()),
                new Point(opposite.x(), corner.y()),
                new Point(opposite.x(), opposite.y()),
                new Point(corner.x(), opposite.y())
        ));
    }

    public int size() {
        return points.size();
    }
}
