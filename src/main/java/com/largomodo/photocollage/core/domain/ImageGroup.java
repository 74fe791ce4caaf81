package com.largomodo.photocollage.core.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * One batch of source images destined for a single collage.
 *
 * @param index   1-based position of the group in the run (names the output files)
 * @param sources source references in input order (unmodifiable)
 */
public record ImageGroup(int index, List<Path> sources) {

    public ImageGroup {
        if (index < 1) {
            throw new IllegalArgumentException("Group index must be 1-based: " + index);
        }
        sources = List.copyOf(sources);
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("Group " + index + " has no sources");
        }
    }

    public int size() {
        return sources.size();
    }

    /**
     * Output base name for this group, zero-padded to two digits ({@code collage_01}).
     */
    public String baseName() {
        return String.format("collage_%02d", index);
    }
}
