package com.project.optical.contrast.service.mask;

import com.project.optical.contrast.DTOs.PolygonRegion;

/**
 * Fills a polygon into a row-major membership mask of {@code width * height}
 * cells. Pixels on the polygon outline count as inside; vertices may lie
 * outside the image and are clipped.
 */
public interface PolygonMaskRasterizer {

    /** Key used by {@code app.contrast.background.mask-engine}. */
    String name();

    boolean[] rasterize(PolygonRegion region, int width, int height);
}
