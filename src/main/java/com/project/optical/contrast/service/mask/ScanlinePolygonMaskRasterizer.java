package com.project.optical.contrast.service.mask;

import com.project.optical.contrast.DTOs.Point;
import com.project.optical.contrast.DTOs.PolygonRegion;
import com.project.optical.contrast.service.LineRasterizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Even-odd scanline fill in plain Java. Each row collects the x crossings of
 * the non-horizontal edges (half-open in y so shared vertices count once),
 * fills between pairs, and the outline is then drawn with the line rasterizer
 * to make the boundary inclusive. Outline edges are clipped to the image
 * first, so vertices far outside it cost no more than the visible part.
 */
@Component
public class ScanlinePolygonMaskRasterizer implements PolygonMaskRasterizer {
    public static final String NAME = "scanline";

    private final LineRasterizer lineRasterizer;

    public ScanlinePolygonMaskRasterizer() {
        this(new LineRasterizer());
    }

    @Autowired
    public ScanlinePolygonMaskRasterizer(LineRasterizer lineRasterizer) {
        this.lineRasterizer = lineRasterizer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean[] rasterize(PolygonRegion region, int width, int height) {
        boolean[] mask = new boolean[width * height];
        List<Point> vertices = region.points();
        int n = vertices.size();

        int minY = Integer.MAX_VALUE, maxY = Integer.MIN_VALUE;
        for (Point p : vertices) {
            minY = Math.min(minY, p.y());
            maxY = Math.max(maxY, p.y());
        }

        double[] crossings = new double[n];
        int fromY = Math.max(0, minY), toY = Math.min(height - 1, maxY);
        for (int y = fromY; y <= toY; y++) {
            int count = 0;
            for (int i = 0; i < n; i++) {
                Point a = vertices.get(i);
                Point b = vertices.get((i + 1) % n);
                if (a.y() == b.y()) continue;

                int lo = Math.min(a.y(), b.y()), hi = Math.max(a.y(), b.y());
                if (y < lo || y >= hi) continue;

                crossings[count++] = a.x() + ((double) y - a.y()) * ((double) b.x() - a.x()) / ((double) b.y() - a.y());
            }
            Arrays.sort(crossings, 0, count);

            int row = y * width;
            for (int i = 0; i + 1 < count; i += 2) {
                int x0 = Math.max(0, (int) Math.ceil(crossings[i]));
                int x1 = Math.min(width - 1, (int) Math.floor(crossings[i + 1]));
                for (int x = x0; x <= x1; x++) {
                    mask[row + x] = true;
                }
            }
        }

        for (int i = 0; i < n; i++) {
            Point[] edge = clip(vertices.get(i), vertices.get((i + 1) % n), width, height);
            if (edge == null) continue;
            for (Point p : lineRasterizer.rasterize(edge[0], edge[1])) {
                if (p.x() >= 0 && p.x() < width && p.y() >= 0 && p.y() < height) {
                    mask[p.y() * width + p.x()] = true;
                }
            }
        }
        return mask;
    }

    /**
     * Liang-Barsky clip of {@code a -> b} to the pixel centres of a
     * {@code width x height} image. Returns {@code null} when the edge misses
     * the image, and the unchanged endpoints when it lies fully inside.
     */
    static Point[] clip(Point a, Point b, int width, int height) {
        double x0 = a.x(), y0 = a.y();
        double dx = (double) b.x() - a.x(), dy = (double) b.y() - a.y();
        double[] p = {-dx, dx, -dy, dy};
        double[] q = {x0, width - 1 - x0, y0, height - 1 - y0};

        double t0 = 0.0, t1 = 1.0;
        for (int i = 0; i < 4; i++) {
            if (p[i] == 0) {
                if (q[i] < 0) return null;
                continue;
            }
            double r = q[i] / p[i];
            if (p[i] < 0) {
                if (r > t1) return null;
                t0 = Math.max(t0, r);
            } else {
                if (r < t0) return null;
                t1 = Math.min(t1, r);
            }
        }
        Point start = t0 == 0.0 ? a : onEdge(x0, y0, dx, dy, t0, width, height);
        Point end = t1 == 1.0 ? b : onEdge(x0, y0, dx, dy, t1, width, height);
        return new Point[]{start, end};
    }

    private static Point onEdge(double x0, double y0, double dx, double dy, double t, int width, int height) {
        int x = (int) Math.rint(x0 + t * dx);
        int y = (int) Math.rint(y0 + t * dy);
        return Point.of(Math.max(0, Math.min(width - 1, x)), Math.max(0, Math.min(height - 1, y)));
    }
}
