package com.largomodo.photocollage.core.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of decoding one group: the usable images and the references that failed.
 * Returned by value so no loader state is shared between runs.
 *
 * @param images decoded images in input order (unmodifiable)
 * @param failed references that could not be decoded, in input order (unmodifiable)
 */
public record LoadResult(List<DecodedImage> images, List<Path> failed) {

    public LoadResult {
        images = List.copyOf(images);
        failed = List.copyOf(failed);
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }
}
