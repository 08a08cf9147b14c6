package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.ChannelProfile;
import com.project.optical.contrast.DTOs.Point;
import com.project.optical.contrast.DTOs.RgbImage;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Reads red, green and blue values at a run of coordinates. Coordinates
 * outside the image are skipped, so the profile may be shorter than the input.
 */
@Service
public class PixelChannelSampler {

    public ChannelProfile sample(RgbImage image, List<Point> coordinates) {
        int n = coordinates.size();
        double[] red = new double[n];
        double[] green = new double[n];
        double[] blue = new double[n];

        int count = 0;
        for (Point p : coordinates) {
            int x = p.x(), y = p.y();
            if (!image.contains(x, y)) continue;

            red[count] = image.red(x, y);
            green[count] = image.green(x, y);
            blue[count] = image.blue(x, y);
            count++;
        }

        if (count == n) {
            return new ChannelProfile(red, green, blue);
        }
        return new ChannelProfile(
                Arrays.copyOf(red, count),
                Arrays.copyOf(green, count),
                Arrays.copyOf(blue, count)
        );
    }
}
