package com.project.optical.contrast.DTOs;

import java.util.Arrays;
import java.util.List;

/**
 * Raw per-channel pixel values along a line cut, either sampled directly or
 * averaged over a band of parallel lines.
 * <p>
 * The channel arrays are copied in and out, and equality compares their contents.
 */
public record ChannelProfile(double[] red, double[] green, double[] blue) {

    public static final ChannelProfile EMPTY = new ChannelProfile(new double[0], new double[0], new double[0]);

    public ChannelProfile {
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

    public boolean isEmpty() {
        return red.length == 0;
    }

    /** Joins profiles end to end, keeping their order. */
    public static ChannelProfile concat(List<ChannelProfile> parts) {
        int total = 0;
        for (ChannelProfile p : parts) total += p.size();

        double[] r = new double[total], g = new double[total], b = new double[total];
        int offset = 0;
        for (ChannelProfile p : parts) {
            System.arraycopy(p.red, 0, r, offset, p.size());
            System.arraycopy(p.green, 0, g, offset, p.size());
            System.arraycopy(p.blue, 0, b, offset, p.size());
            offset += p.size();
        }
        return new ChannelProfile(r, g, b);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChannelProfile other
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
        return "ChannelProfile[r=" + Arrays.toString(red)
                + ", g=" + Arrays.toString(green)
                + ", b=" + Arrays.toString(blue) + "]";
    }
}
