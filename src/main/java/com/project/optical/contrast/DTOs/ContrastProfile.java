package com.project.optical.contrast.DTOs;

import java.util.Arrays;

/**
 * Signed contrast fractions per channel, one sample per pixel position of the
 * whole line cut. Negative values are darker than the background.
 * <p>
 * The channel arrays are copied in and out, and equality compares their contents.
 */
public record ContrastProfile(double[] red, double[] green, double[] blue) {

    public ContrastProfile {
        if (red.length != green.length || red.length != blue.length) {
            throw new IllegalArgumentException("Channel lengths differ: "
                    + red.length + "/" + green.length + "/" + blue.length);
        }
        red = red.clone();
        green = green.clone();
        blue = blue.clone();
    }

    public double[] red() {
        return red.clone();
    }

    public double[] green() {
        return green.clone();
    }

    public double[] blue() {
        return blue.clone();
    }

    public int size() {
        return red.length;
    }

    /** Same profile scaled by 100, for display. */
    public ContrastProfile toPercent() {
        return new ContrastProfile(scale(red), scale(green), scale(blue));
    }

    private static double[] scale(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * 100.0;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ContrastProfile other
                && Arrays.equals(red, other.red)
                && Arrays.equals(green, other.green)
                && Arrays.equals(blue, other.blue);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(red);
        h = 31 * h + Arrays.hashCode(green);
        return 31 * h + Arrays.hashCode(blue);
    }

    @Override
    public String toString() {
        return "ContrastProfile[r=" + Arrays.toString(red)
                + ", g=" + Arrays.toString(green)
                + ", b=" + Arrays.toString(blue) + "]";
    }
}
