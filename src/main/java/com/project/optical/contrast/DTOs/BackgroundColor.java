package com.project.optical.contrast.DTOs;

/** Mean reference color of a background region, one integer per channel. */
public record BackgroundColor(int red, int green, int blue) {

    /** Used when a region covers no pixel of the image. */
    public static final BackgroundColor WHITE = new BackgroundColor(255, 255, 255);

    public BackgroundColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range [0, 255]: " + value);
        }
    }
}
