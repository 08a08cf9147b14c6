package com.project.optical.contrast.DTOs;

/** Integer pixel coordinate in image space. */
public record Point(int x, int y) {

    public static Point of(int x, int y) {
        return new Point(x, y);
    }
}
