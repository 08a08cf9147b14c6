package com.project.optical.contrast.DTOs;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.Objects;

/**
 * Read-only grid of packed RGB pixels. Instances are never modified after
 * construction and can be shared between threads.
 */
public final class RgbImage {

    private final int width;
    private final int height;
    private final int[] rgb;

    private RgbImage(int width, int height, int[] rgb) {
        this.width = width;
        this.height = height;
        this.rgb = rgb;
    }

    /**
     * Copies the pixels of {@code image}. Single-band sources are read from the
     * raster without color conversion, so a stored intensity {@code v} becomes
     * {@code r = g = b = v}. Samples wider than 8 bits keep their high byte.
     */
    public static RgbImage from(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        int w = image.getWidth(), h = image.getHeight();
        Raster raster = image.getRaster();
        if (raster.getNumBands() == 1) {
            return new RgbImage(w, h, grayToRgb(raster, w, h));
        }
        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);
        return new RgbImage(w, h, argb);
    }

    private static int[] grayToRgb(Raster raster, int w, int h) {
        int shift = Math.max(0, raster.getSampleModel().getSampleSize(0) - 8);
        int minX = raster.getMinX(), minY = raster.getMinY();
        int[] rgb = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int v = (raster.getSample(minX + x, minY + y, 0) >>> shift) & 0xFF;
                rgb[y * w + x] = (v << 16) | (v << 8) | v;
            }
        }
        return rgb;
    }

    /** Wraps a copy of row-major {@code 0xRRGGBB} values. */
    public static RgbImage of(int width, int height, int[] packedRgb) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must not be empty: " + width + "x" + height);
        }
        if (packedRgb.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " pixels, received " + packedRgb.length);
        }
        return new RgbImage(width, height, packedRgb.clone());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int red(int x, int y) {
        return (rgb[y * width + x] >> 16) & 0xFF;
    }

    public int green(int x, int y) {
        return (rgb[y * width + x] >> 8) & 0xFF;
    }

    public int blue(int x, int y) {
        return rgb[y * width + x] & 0xFF;
    }

    @Override
    public String toString() {
        return "RgbImage[" + width + "x" + height + "]";
    }
}
