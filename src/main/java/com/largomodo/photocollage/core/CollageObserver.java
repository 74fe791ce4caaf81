package com.largomodo.photocollage.core;

import com.largomodo.photocollage.core.domain.ImageGroup;

import java.nio.file.Path;

/**
 * Observer interface for collage run lifecycle events.
 * <p>
 * All callbacks fire on the thread running {@link CollageProcessor#process}, in group order.
 * Every method has a default no-op implementation, so consumers override only the events
 * they care about.
 * </p>
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * CollageObserver observer = new CollageObserver() {
 *     @Override
 *     public void onGroupComplete(GroupOutcome outcome) {
 *         progressBar.step();
 *     }
 * };
 * }</pre>
 *
 * @see CollageProcessor
 */
public interface CollageObserver {

    CollageObserver NONE = new CollageObserver() {
    };

    /**
     * Called before a group's images are loaded.
     *
     * @param group      the group about to be processed
     * @param groupCount total number of groups in the run
     */
    default void onGroupStart(ImageGroup group, int groupCount) {}

    /**
     * Called for each source that could not be decoded. The group carries on without it.
     *
     * @param source the unreadable reference
     * @param e      the decode failure
     */
    default void onImageFailed(Path source, Exception e) {}

    /**
     * Called after a group's export attempt, whether it succeeded, partly failed, failed,
     * or was skipped because no image decoded.
     *
     * @param outcome what happened to the group
     */
    default void onGroupComplete(GroupOutcome outcome) {}
}
