package com.largomodo.photocollage.core;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Encodes a finished canvas into the output formats.
 */
public interface CollageExporter {

    /**
     * Encodes the canvas once per {@link OutputFormat}.
     * <p>
     * A failure in one format is returned as a failed {@link EncodedOutput}; it never prevents
     * the remaining formats from being attempted.
     *
     * @param canvas assembled ARGB canvas
     * @param dpi    resolution recorded in each file's metadata
     * @return one entry per format, in {@link OutputFormat} declaration order
     */
    List<EncodedOutput> export(BufferedImage canvas, int dpi);
}
