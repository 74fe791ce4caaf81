package com.largomodo.photocollage.core;

/**
 * Thrown when a run has no source images at all.
 * <p>
 * The only condition that aborts a whole run; raised before any group is processed.
 */
public class NoInputImagesException extends RuntimeException {

    public NoInputImagesException(String message) {
        super(message);
    }
}
