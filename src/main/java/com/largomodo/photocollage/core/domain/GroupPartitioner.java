package com.largomodo.photocollage.core.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the ordered source list into fixed-size groups.
 * <p>
 * Every group holds exactly {@code groupSize} references except the last, which holds the
 * remainder (1..groupSize). Order is never changed: concatenating the groups reproduces the input.
 */
public class GroupPartitioner {

    public List<ImageGroup> partition(List<Path> sources, int groupSize) {
        if (sources == null) {
            throw new IllegalArgumentException("Sources list cannot be null");
        }
        if (groupSize <= 0) {
            throw new IllegalArgumentException("Group size must be positive: " + groupSize);
        }

        List<ImageGroup> groups = new ArrayList<>();
        for (int start = 0; start < sources.size(); start += groupSize) {
            int end = Math.min(start + groupSize, sources.size());
            groups.add(new ImageGroup(groups.size() + 1, sources.subList(start, end)));
        }
        return groups;
    }
}
