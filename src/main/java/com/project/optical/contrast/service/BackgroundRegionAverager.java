package com.project.optical.contrast.service;

import com.project.optical.contrast.DTOs.BackgroundColor;
import com.project.optical.contrast.DTOs.PolygonRegion;
import com.project.optical.contrast.DTOs.RgbImage;
import com.project.optical.contrast.exceptions.ContrastException;
import com.project.optical.contrast.service.mask.PolygonMaskRasterizer;
import com.project.optical.contrast.service.mask.ScanlinePolygonMaskRasterizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Mean color of the pixels inside a background polygon. Channel means are
 * truncated to integers; a region that covers no pixel yields white.
 */
@Service
public class BackgroundRegionAverager {
    private static final Logger log = LoggerFactory.getLogger(BackgroundRegionAverager.class);

    private final PolygonMaskRasterizer maskRasterizer;

    public BackgroundRegionAverager() {
        this(new ScanlinePolygonMaskRasterizer());
    }

    public BackgroundRegionAverager(PolygonMaskRasterizer maskRasterizer) {
        this.maskRasterizer = maskRasterizer;
    }

    @Autowired
    public BackgroundRegionAverager(List<PolygonMaskRasterizer> engines,
                                    @Value("${app.contrast.background.mask-engine:scanline}") String engine) {
        this(select(engines, engine));
        log.info("Using '{}' polygon mask engine", engine);
    }

    private static PolygonMaskRasterizer select(List<PolygonMaskRasterizer> engines, String engine) {
        return engines.stream()
                .filter(e -> e.name().equalsIgnoreCase(engine.trim()))
                .findFirst()
                .orElseThrow(() -> new ContrastException("Unknown mask engine '" + engine + "' (available: "
                        + engines.stream().map(PolygonMaskRasterizer::name).collect(Collectors.joining(", ")) + ")"));
    }

    public BackgroundColor average(RgbImage image, PolygonRegion region) {
        final int w = image.width(), h = image.height();
        boolean[] mask = maskRasterizer.rasterize(region, w, h);

        long sumRed = 0, sumGreen = 0, sumBlue = 0;
        long count = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!mask[y * w + x]) continue;
                sumRed += image.red(x, y);
                sumGreen += image.green(x, y);
                sumBlue += image.blue(x, y);
                count++;
            }
        }

        if (count == 0) {
            log.warn("Background region with {} points covers no pixels of the {}x{} image, using {}",
                    region.size(), w, h, BackgroundColor.WHITE);
            return BackgroundColor.WHITE;
        }

        BackgroundColor color = new BackgroundColor(
                (int) (sumRed / count),
                (int) (sumGreen / count),
                (int) (sumBlue / count)
        );
        log.debug("Background averaged over {} pixels: {}", count, color);
        return color;
    }
}
