package com.largomodo.photocollage.render;

import com.largomodo.photocollage.core.domain.GridPlan;

import java.awt.image.BufferedImage;

/**
 * A finished collage canvas and the grid it was laid out on.
 *
 * @param image        ARGB canvas of exactly the configured size
 * @param grid         grid used for placement
 * @param placedImages number of photos drawn onto the canvas
 */
public record ComposedCanvas(BufferedImage image, GridPlan grid, int placedImages) {
}
