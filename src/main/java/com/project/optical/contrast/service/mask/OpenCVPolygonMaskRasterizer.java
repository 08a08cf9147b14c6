package com.project.optical.contrast.service.mask;

import com.project.optical.contrast.DTOs.PolygonRegion;
import com.project.optical.contrast.exceptions.ContrastException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polygon fill through {@link Imgproc#fillPoly}. The native library is loaded
 * on first use, so selecting the scanline engine never touches OpenCV.
 */
@Component
public class OpenCVPolygonMaskRasterizer implements PolygonMaskRasterizer {
    private static final Logger log = LoggerFactory.getLogger(OpenCVPolygonMaskRasterizer.class);
    public static final String NAME = "opencv";

    @Override
    public String name() {
        return NAME;
    }

    public static boolean isAvailable() {
        return NativeLibrary.LOADED;
    }

    @Override
    public boolean[] rasterize(PolygonRegion region, int width, int height) {
        if (!isAvailable()) {
            throw new ContrastException("OpenCV native library is not available; use the '"
                    + ScanlinePolygonMaskRasterizer.NAME + "' mask engine instead");
        }

        Point[] vertices = region.points().stream()
                .map(p -> new Point(p.x(), p.y()))
                .toArray(Point[]::new);
        MatOfPoint polygon = new MatOfPoint(vertices);
        Mat mask = Mat.zeros(height, width, CvType.CV_8UC1);
        try {
            Imgproc.fillPoly(mask, List.of(polygon), new Scalar(255));
            return matToBooleanArray(mask);
        } catch (RuntimeException e) {
            log.error("OpenCV polygon fill failed for {}", region, e);
            throw new ContrastException("OpenCV polygon fill failed: " + e.getMessage(), e);
        } finally {
            mask.release();
            polygon.release();
        }
    }

    private static boolean[] matToBooleanArray(Mat mask) {
        int rows = mask.rows();
        int cols = mask.cols();
        boolean[] result = new boolean[rows * cols];
        byte[] data = new byte[rows * cols];
        mask.get(0, 0, data);

        for (int i = 0; i < data.length; i++) {
            result[i] = (data[i] & 0xFF) > 127;
        }
        return result;
    }

    private static final class NativeLibrary {
        static final boolean LOADED = load();

        private static boolean load() {
            try {
                nu.pattern.OpenCV.loadLocally();
                log.info("OpenCV loaded successfully");
                return true;
            } catch (Exception | UnsatisfiedLinkError e) {
                log.error("Failed to load OpenCV", e);
                return false;
            }
        }
    }
}
