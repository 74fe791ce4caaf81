package com.largomodo.photocollage.core.domain;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * A successfully decoded source image, normalized to 4-channel ARGB.
 * <p>
 * Owned by the group being processed and dropped once its cell is placed.
 *
 * @param source reference the pixels were decoded from
 * @param pixels ARGB pixel buffer ({@link BufferedImage#TYPE_INT_ARGB})
 */
public record DecodedImage(Path source, BufferedImage pixels) {

    public DecodedImage {
        if (pixels.getType() != BufferedImage.TYPE_INT_ARGB) {
            throw new IllegalArgumentException("Decoded image must be TYPE_INT_ARGB: " + source);
        }
    }

    public int width() {
        return pixels.getWidth();
    }

    public int height() {
        return pixels.getHeight();
    }
}
