package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.Point;
import com.project.optical.contrast.DTOs.Segment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bresenham rasterization of a segment into an 8-connected run of pixels.
 * <p>
 * The walk always starts from the lexicographically smaller endpoint, so a
 * reversed segment yields exactly the reversed run of pixels.
 */
@Service
public class LineRasterizer {

    public List<Point> rasterize(Segment segment) {
        return rasterize(segment.start(), segment.end());
    }

    public List<Point> rasterize(Point from, Point to) {
        if (from.x() > to.x() || (from.x() == to.x() && from.y() > to.y())) {
            List<Point> points = walk(to.x(), to.y(), from.x(), from.y());
            Collections.reverse(points);
            return points;
        }
        return walk(from.x(), from.y(), to.x(), to.y());
    }

    private static List<Point> walk(int x1, int y1, int x2, int y2) {
        int dx = Math.abs(x2 - x1);
        int dy = Math.abs(y2 - y1);
        boolean steep = dy > dx;

        if (steep) {
            int t = x1; x1 = y1; y1 = t;
            t = x2; x2 = y2; y2 = t;
            t = dx; dx = dy; dy = t;
        }

        int sx = x1 < x2 ? 1 : -1;
        int sy = y1 < y2 ? 1 : -1;
        int err = dx - dy;

        List<Point> points = new ArrayList<>(dx + 1);
        while (true) {
            points.add(steep ? new Point(y1, x1) : new Point(x1, y1));
            if (x1 == x2 && y1 == y2) break;

            int e2 = err * 2;
            if (e2 > -dy) {
                err -= dy;
                x1 += sx;
            }
            if (e2 < dx) {
                err += dx;
                y1 += sy;
            }
        }
        return points;
    }
}
