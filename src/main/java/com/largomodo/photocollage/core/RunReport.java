package com.largomodo.photocollage.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one collage run.
 *
 * @param groupCount   number of groups the sources were split into
 * @param outcomes     per-group results in processing order (unmodifiable)
 * @param failedImages every source that failed to decode, in encounter order (unmodifiable)
 * @param cancelled    true when the run stopped at a group boundary on request
 */
public record RunReport(int groupCount, List<GroupOutcome> outcomes, List<Path> failedImages, boolean cancelled) {

    /** Number of failed references listed individually by {@link #summaryLines()}. */
    static final int SUMMARY_FAILURE_LIMIT = 10;

    public RunReport {
        outcomes = List.copyOf(outcomes);
        failedImages = List.copyOf(failedImages);
    }

    public int groupsAttempted() {
        return outcomes.size();
    }

    public int groupsWithOutput() {
        return (int) outcomes.stream().filter(GroupOutcome::producedOutput).count();
    }

    public int emptyGroups() {
        return (int) outcomes.stream().filter(o -> o.status() == GroupOutcome.Status.EMPTY).count();
    }

    /**
     * Human-readable summary: totals, then at most ten failed references and a
     * "... and N more" line for the rest.
     */
    public List<String> summaryLines() {
        List<String> lines = new ArrayList<>();
        lines.add("Total collages generated: " + groupsWithOutput() + "/" + groupCount);
        if (cancelled) {
            lines.add("Run cancelled after " + groupsAttempted() + " group(s)");
        }
        if (!failedImages.isEmpty()) {
            lines.add("Skipped " + failedImages.size() + " corrupted/unreadable image(s):");
            failedImages.stream()
                    .limit(SUMMARY_FAILURE_LIMIT)
                    .forEach(path -> lines.add("  - " + path));
            if (failedImages.size() > SUMMARY_FAILURE_LIMIT) {
                lines.add("  ... and " + (failedImages.size() - SUMMARY_FAILURE_LIMIT) + " more");
            }
        }
        return lines;
    }
}
