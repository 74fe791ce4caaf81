package com.largomodo.photocollage.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Recognizes photo files by extension.
 * <p>
 * Only the name is inspected; whether the content actually decodes is left to the loader,
 * which records corrupt files as failures instead of silently dropping them here.
 */
public class ImageFileMatcher {

    private static final Set<String> EXTENSIONS = Set.of(
            ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".tiff", ".tif", ".webp"
    );

    private ImageFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check if path is a regular file with a recognized image extension (case-insensitive).
     *
     * @param path file path to check (can be null)
     * @return true for image files, false for null, directories and other files
     */
    public static boolean isImage(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }

        if (!Files.isRegularFile(path)) {
            return false;
        }

        String filename = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (filename.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
