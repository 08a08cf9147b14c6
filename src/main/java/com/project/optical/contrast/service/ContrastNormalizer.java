package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.BackgroundColor;
import com.project.optical.contrast.DTOs.ChannelProfile;
import com.project.optical.contrast.DTOs.ContrastProfile;
import org.springframework.stereotype.Service;

/**
 * Converts raw channel values into {@code (sample - bg) / bg}. A background
 * channel of 0 carries no information, so that channel reads 0 throughout.
 */
@Service
public class ContrastNormalizer {

    public ContrastProfile normalize(ChannelProfile raw, BackgroundColor background) {
        return new ContrastProfile(
                normalize(raw.red(), background.red()),
                normalize(raw.green(), background.green()),
                normalize(raw.blue(), background.blue())
        );
    }

    static double[] normalize(double[] samples, int background) {
        double[] out = new double[samples.length];
        if (background == 0) {
            return out;
        }
        for (int i = 0; i < samples.length; i++) {
            out[i] = (samples[i] - background) / background;
        }
        return out;
    }
}
