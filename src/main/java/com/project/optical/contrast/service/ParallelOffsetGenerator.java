package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.Point;
import com.project.optical.contrast.DTOs.Segment;
import org.springframework.stereotype.Service;

/**
 * Shifts a segment sideways along its unit normal {@code (-dy, dx) / length}.
 * Positive and negative distances land on opposite sides of the segment.
 */
@Service
public class ParallelOffsetGenerator {

    public Segment offset(Segment segment, double distance) {
        double dx = segment.end().x() - segment.start().x();
        double dy = segment.end().y() - segment.start().y();
        double length = Math.hypot(dx, dy);

        if (length == 0) {
            return segment;
        }

        double offsetX = distance * (-dy / length);
        double offsetY = distance * (dx / length);

        return new Segment(
                shift(segment.start(), offsetX, offsetY),
                shift(segment.end(), offsetX, offsetY)
        );
    }

    // half-to-even, so +d and -d shift by exactly opposite amounts
    private static Point shift(Point p, double offsetX, double offsetY) {
        return new Point((int) Math.rint(p.x() + offsetX), (int) Math.rint(p.y() + offsetY));
    }
}
