package com.largomodo.photocollage.core.workspace;

import java.io.IOException;
import java.util.List;

/**
 * Thrown when staged collage files cannot be removed after a group is written.
 * <p>
 * Every individual deletion failure is attached as a suppressed exception.
 */
public class CleanupException extends RuntimeException {

    /**
     * @param message  description of the staging area that could not be cleaned
     * @param failures deletion failures, each added as suppressed
     */
    public CleanupException(String message, List<IOException> failures) {
        super(message);
        for (IOException failure : failures) {
            addSuppressed(failure);
        }
    }
}
