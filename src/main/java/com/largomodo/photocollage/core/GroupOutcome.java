package com.largomodo.photocollage.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of processing one group.
 *
 * @param groupIndex    1-based group index
 * @param baseName      output base name, e.g. {@code collage_01}
 * @param status        overall result
 * @param placedImages  number of photos rendered onto the canvas
 * @param failedSources sources of this group that failed to decode (unmodifiable)
 * @param writtenFiles  output files written for this group (unmodifiable)
 * @param exportErrors  one message per output format that could not be produced (unmodifiable)
 */
public record GroupOutcome(
        int groupIndex,
        String baseName,
        Status status,
        int placedImages,
        List<Path> failedSources,
        List<Path> writtenFiles,
        List<String> exportErrors
) {

    public GroupOutcome {
        failedSources = List.copyOf(failedSources);
        writtenFiles = List.copyOf(writtenFiles);
        exportErrors = List.copyOf(exportErrors);
    }

    public boolean producedOutput() {
        return status == Status.EXPORTED || status == Status.PARTIAL;
    }

    public enum Status {
        /** Every output format was written. */
        EXPORTED,
        /** At least one output format was written, at least one failed. */
        PARTIAL,
        /** No output format could be written. */
        FAILED,
        /** No image of the group decoded; nothing was composed or written. */
        EMPTY
    }
}
