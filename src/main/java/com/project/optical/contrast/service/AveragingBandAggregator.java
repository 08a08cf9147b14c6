package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.ChannelProfile;
import com.project.optical.contrast.DTOs.RgbImage;
import com.project.optical.contrast.DTOs.SampleChain;
import com.project.optical.contrast.DTOs.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Averages a line cut over a band of parallel lines to reduce pixel noise.
 * <p>
 * For width {@code W} the band is the center line plus the offsets
 * {@code ±1 … ±W/2}. An offset line whose clipped sample count differs from
 * the center line is dropped as a whole instead of being merged partially, so
 * near the image border fewer lines may contribute than requested.
 */
@Service
public class AveragingBandAggregator {
    private static final Logger log = LoggerFactory.getLogger(AveragingBandAggregator.class);

    private static final int[] SIDES = {1, -1};

    private final LineRasterizer rasterizer;
    private final ParallelOffsetGenerator offsetGenerator;
    private final PixelChannelSampler sampler;

    public AveragingBandAggregator() {
        this(new LineRasterizer(), new ParallelOffsetGenerator(), new PixelChannelSampler());
    }

    @Autowired
    public AveragingBandAggregator(LineRasterizer rasterizer,
                                   ParallelOffsetGenerator offsetGenerator,
                                   PixelChannelSampler sampler) {
        this.rasterizer = rasterizer;
        this.offsetGenerator = offsetGenerator;
        this.sampler = sampler;
    }

    /** Averaged profiles of every segment of {@code chain}, concatenated in chain order. */
    public ChannelProfile average(RgbImage image, SampleChain chain, int width) {
        List<ChannelProfile> parts = new ArrayList<>(chain.size());
        for (Segment segment : chain.segments()) {
            ChannelProfile part = average(image, segment, width);
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return ChannelProfile.concat(parts);
    }

    public ChannelProfile average(RgbImage image, Segment segment, int width) {
        ChannelProfile center = sampleLine(image, segment);
        int n = center.size();
        if (n == 0) {
            log.debug("Segment {} lies outside the {}x{} image", segment, image.width(), image.height());
            return ChannelProfile.EMPTY;
        }

        int halfWidth = width / 2;
        if (halfWidth <= 0) {
            return center;
        }

        double[] red = center.red(), green = center.green(), blue = center.blue();
        int lines = 1;

        for (int k = 1; k <= halfWidth; k++) {
            for (int side : SIDES) {
                ChannelProfile line = sampleLine(image, offsetGenerator.offset(segment, side * k));
                if (line.size() != n) {
                    log.debug("Dropping offset line {} of {}: {} samples instead of {}",
                            side * k, segment, line.size(), n);
                    continue;
                }
                double[] lineRed = line.red(), lineGreen = line.green(), lineBlue = line.blue();
                for (int i = 0; i < n; i++) {
                    red[i] += lineRed[i];
                    green[i] += lineGreen[i];
                    blue[i] += lineBlue[i];
                }
                lines++;
            }
        }

        for (int i = 0; i < n; i++) {
            red[i] /= lines;
            green[i] /= lines;
            blue[i] /= lines;
        }
        log.debug("Averaged {} of {} lines over {} samples for {}", lines, 2 * halfWidth + 1, n, segment);
        return new ChannelProfile(red, green, blue);
    }

    private ChannelProfile sampleLine(RgbImage image, Segment segment) {
        return sampler.sample(image, rasterizer.rasterize(segment));
    }
}
