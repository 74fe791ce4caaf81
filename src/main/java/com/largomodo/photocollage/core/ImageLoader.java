package com.largomodo.photocollage.core;

import com.largomodo.photocollage.core.domain.DecodedImage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes source images for the pipeline.
 * <p>
 * Core depends on this abstraction; the service package provides the codec-backed implementation.
 */
public interface ImageLoader {

    /**
     * Decodes one source and normalizes it to 4-channel ARGB.
     *
     * @param source image reference
     * @return decoded image with non-zero dimensions
     * @throws IOException if the file is unreadable, not a supported image, corrupt, or empty
     */
    DecodedImage load(Path source) throws IOException;
}
