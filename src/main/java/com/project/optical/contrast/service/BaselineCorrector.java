package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.ContrastProfile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Shifts a contrast profile so that the median of its {@code topK} largest
 * values becomes zero. Line cuts cross mostly bare background, so that bright
 * plateau should sit at zero contrast.
 * <p>
 * Apply once per profile: running it again moves the baseline further.
 */
@Service
public class BaselineCorrector {

    private final int topK;

    public BaselineCorrector() {
        this(3);
    }

    @Autowired
    public BaselineCorrector(@Value("${app.contrast.baseline.top-k:3}") int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("top-k must be at least 1: " + topK);
        }
        this.topK = topK;
    }

    public ContrastProfile correct(ContrastProfile profile) {
        return new ContrastProfile(
                correct(profile.red()),
                correct(profile.green()),
                correct(profile.blue())
        );
    }

    public double[] correct(double[] values) {
        if (values.length == 0) {
            return values;
        }
        double baseline = topMedian(values);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - baseline;
        }
        return out;
    }

    /** Median of the {@code min(topK, n)} largest values. */
    double topMedian(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int k = Math.min(topK, sorted.length);
        int from = sorted.length - k;
        int mid = from + k / 2;
        return (k % 2 == 1) ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
