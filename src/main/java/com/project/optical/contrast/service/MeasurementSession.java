package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.BackgroundColor;
import com.project.optical.contrast.DTOs.Measurement;
import com.project.optical.contrast.DTOs.PolygonRegion;
import com.project.optical.contrast.DTOs.RgbImage;
import com.project.optical.contrast.DTOs.SampleChain;
import com.project.optical.contrast.exceptions.ContrastException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller-owned workspace for one image: the current background and the line
 * cut measurements taken against it. Redefining the background recomputes
 * every measurement. Not thread-safe.
 */
public class MeasurementSession {
    private static final Logger log = LoggerFactory.getLogger(MeasurementSession.class);

    private final ContrastMeasurementService service;
    private final RgbImage image;
    private final List<Measurement> measurements = new ArrayList<>();
    private PolygonRegion backgroundRegion;
    private BackgroundColor background;

    MeasurementSession(ContrastMeasurementService service, RgbImage image) {
        this.service = Objects.requireNonNull(service, "service");
        this.image = Objects.requireNonNull(image, "image");
    }

    /**
     * Sets the background from {@code region} and recomputes every measurement
     * against it. If any step fails the session keeps its previous state.
     */
    public BackgroundColor defineBackground(PolygonRegion region) {
        BackgroundColor color = service.backgroundColor(image, region);

        List<Measurement> recomputed = new ArrayList<>(measurements.size());
        if (!measurements.isEmpty()) {
            log.info("Background changed to {}, recomputing {} measurement(s)", color, measurements.size());
            for (Measurement m : measurements) {
                recomputed.add(service.measure(m.name(), image, m.chain(), color, m.width()));
            }
        }

        this.backgroundRegion = region;
        this.background = color;
        measurements.clear();
        measurements.addAll(recomputed);
        return color;
    }

    public Measurement addLineCut(SampleChain chain) {
        return addLineCut(chain, service.defaultWidth());
    }

    public Measurement addLineCut(SampleChain chain, int width) {
        if (background == null) {
            throw new ContrastException("Define a background region before adding a line cut");
        }
        checkWidth(width);
        Measurement m = service.measure(nameFor(measurements.size()), image, chain, background, width);
        measurements.add(m);
        return m;
    }

    public Measurement changeWidth(int index, int width) {
        Objects.checkIndex(index, measurements.size());
        checkWidth(width);
        Measurement old = measurements.get(index);
        Measurement updated = service.measure(old.name(), image, old.chain(), background, width);
        measurements.set(index, updated);
        return updated;
    }

    public Measurement remove(int index) {
        Objects.checkIndex(index, measurements.size());
        Measurement removed = measurements.remove(index);
        for (int i = index; i < measurements.size(); i++) {
            measurements.set(i, measurements.get(i).withName(nameFor(i)));
        }
        log.debug("Removed '{}', {} measurement(s) left", removed.name(), measurements.size());
        return removed;
    }

    public RgbImage image() {
        return image;
    }

    public Optional<BackgroundColor> background() {
        return Optional.ofNullable(background);
    }

    public Optional<PolygonRegion> backgroundRegion() {
        return Optional.ofNullable(backgroundRegion);
    }

    public List<Measurement> measurements() {
        return List.copyOf(measurements);
    }

    private void checkWidth(int width) {
        if (width < 1 || width > service.maxWidth()) {
            throw new IllegalArgumentException(
                    "Averaging width must be between 1 and " + service.maxWidth() + ": " + width);
        }
    }

    private static String nameFor(int index) {
        return "Linecut " + (index + 1);
    }
}
