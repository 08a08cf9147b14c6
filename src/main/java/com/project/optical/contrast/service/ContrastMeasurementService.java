package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.BackgroundColor;
import com.project.optical.contrast.DTOs.ChannelProfile;
import com.project.optical.contrast.DTOs.ContrastProfile;
import com.project.optical.contrast.DTOs.Measurement;
import com.project.optical.contrast.DTOs.PolygonRegion;
import com.project.optical.contrast.DTOs.RgbImage;
import com.project.optical.contrast.DTOs.SampleChain;
import com.project.optical.contrast.exceptions.ContrastException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

/**
 * Runs the measurement pipeline: band averaging, normalization against the
 * background color and baseline correction. Holds no per-image state; callers
 * that need one keep it in a {@link MeasurementSession}.
 */
@Service
public class ContrastMeasurementService {
    private static final Logger log = LoggerFactory.getLogger(ContrastMeasurementService.class);

    private final AveragingBandAggregator aggregator;
    private final BackgroundRegionAverager backgroundAverager;
    private final ContrastNormalizer normalizer;
    private final BaselineCorrector baselineCorrector;
    private final Executor executor;
    private final int defaultWidth;
    private final int maxWidth;

    public ContrastMeasurementService() {
        this(new AveragingBandAggregator(), new BackgroundRegionAverager(), new ContrastNormalizer(),
                new BaselineCorrector(), ForkJoinPool.commonPool(), 10, 999);
    }

    @Autowired
    public ContrastMeasurementService(AveragingBandAggregator aggregator,
                                      BackgroundRegionAverager backgroundAverager,
                                      ContrastNormalizer normalizer,
                                      BaselineCorrector baselineCorrector,
                                      ExecutorService measurementExecutor,
                                      @Value("${app.contrast.default-width:10}") int defaultWidth,
                                      @Value("${app.contrast.max-width:999}") int maxWidth) {
        if (maxWidth < 1 || defaultWidth < 1 || defaultWidth > maxWidth) {
            throw new IllegalArgumentException(
                    "Invalid width settings: default=" + defaultWidth + ", max=" + maxWidth);
        }
        this.aggregator = aggregator;
        this.backgroundAverager = backgroundAverager;
        this.normalizer = normalizer;
        this.baselineCorrector = baselineCorrector;
        this.executor = measurementExecutor;
        this.defaultWidth = defaultWidth;
        this.maxWidth = maxWidth;
    }

    public BackgroundColor backgroundColor(RgbImage image, PolygonRegion region) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(region, "region");
        log.info("Averaging background region with {} points on image {}x{}",
                region.size(), image.width(), image.height());
        return backgroundAverager.average(image, region);
    }

    /** Band-averaged channel values of {@code chain}, before normalization. */
    public ChannelProfile rawProfile(RgbImage image, SampleChain chain, int width) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(chain, "chain");
        return aggregator.average(image, chain, width);
    }

    /** Baseline-corrected contrast of {@code chain} against {@code background}. */
    public ContrastProfile contrast(RgbImage image, SampleChain chain, BackgroundColor background, int width) {
        Objects.requireNonNull(background, "background");
        ChannelProfile raw = rawProfile(image, chain, width);
        ContrastProfile profile = baselineCorrector.correct(normalizer.normalize(raw, background));
        log.debug("Contrast computed for {} segment(s), width {}: {} samples",
                chain.size(), width, profile.size());
        return profile;
    }

    public Measurement measure(String name, RgbImage image, SampleChain chain,
                               BackgroundColor background, int width) {
        log.info("Measuring '{}' with {} segment(s), width {}, background {}",
                name, chain.size(), width, background);
        return new Measurement(name, chain, width, contrast(image, chain, background, width));
    }

    /** Computes every chain in parallel; results keep the order of {@code chains}. */
    public List<ContrastProfile> measureAll(RgbImage image, List<SampleChain> chains,
                                            BackgroundColor background, int width) {
        log.info("Measuring {} line cut(s) on image {}x{}, width {}",
                chains.size(), image.width(), image.height(), width);

        List<CompletableFuture<ContrastProfile>> futures = new ArrayList<>(chains.size());
        for (SampleChain chain : chains) {
            futures.add(CompletableFuture.supplyAsync(() -> contrast(image, chain, background, width), executor));
        }

        List<ContrastProfile> profiles = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<ContrastProfile> future : futures) {
                profiles.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new ContrastException("Line cut measurement failed", e.getCause());
        }
        return profiles;
    }

    public MeasurementSession openSession(RgbImage image) {
        return new MeasurementSession(this, image);
    }

    public int defaultWidth() {
        return defaultWidth;
    }

    public int maxWidth() {
        return maxWidth;
    }
}
