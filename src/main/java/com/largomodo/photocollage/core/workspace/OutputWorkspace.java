package com.largomodo.photocollage.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Staging area for one collage's output files.
 * <p>
 * Encoded files are first written into a hidden staging directory next to the final outputs,
 * then promoted with an atomic move, so a final {@code collage_NN.*} name only ever refers to a
 * complete file. {@link #close()} removes whatever was staged but never promoted, including the
 * staging directory itself; use it with try-with-resources.
 */
public class OutputWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OutputWorkspace.class);

    private final Path outputDir;
    private final Path stagingDir;
    private final List<Path> trackedFiles = new ArrayList<>();

    /**
     * @param outputDir    directory receiving the final files
     * @param baseName     collage base name, e.g. {@code collage_01}
     * @param uniqueSuffix suffix keeping concurrent runs into the same directory apart
     */
    public OutputWorkspace(Path outputDir, String baseName, String uniqueSuffix) {
        this.outputDir = outputDir;
        this.stagingDir = outputDir.resolve("." + baseName + "." + uniqueSuffix);
    }

    public Path getStagingDir() {
        return stagingDir;
    }

    /**
     * Writes content into the staging directory, creating it on first use.
     *
     * @param fileName final file name
     * @param data     file content
     * @return path of the staged file
     * @throws IOException if the staging directory or file cannot be written
     */
    public Path stage(String fileName, byte[] data) throws IOException {
        if (!Files.isDirectory(stagingDir)) {
            Files.createDirectories(stagingDir);
            track(stagingDir);
        }
        Path staged = stagingDir.resolve(fileName);
        track(staged);
        Files.write(staged, data);
        return staged;
    }

    /**
     * Track an artifact for deletion on close(). Later entries are deleted first.
     */
    public void track(Path artifact) {
        trackedFiles.add(artifact);
    }

    /**
     * Stop tracking a file so close() leaves it in place.
     */
    public void markAsOutput(Path finalFile) {
        trackedFiles.remove(finalFile);
    }

    /**
     * Moves a staged file to the output directory under the same name.
     * <p>
     * Atomic move when the filesystem supports it, otherwise copy then delete. An existing
     * file of the same name is replaced (with a warning).
     *
     * @param staged file previously returned by {@link #stage}
     * @return final path
     * @throws IOException if the move or fallback copy fails
     */
    public Path promote(Path staged) throws IOException {
        Path target = outputDir.resolve(staged.getFileName());

        if (Files.exists(target)) {
            log.warn("Overwriting existing file: {}", target);
        }

        try {
            Files.move(staged, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.copy(staged, target, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.delete(staged);
            } catch (IOException deleteEx) {
                IOException compositeEx = new IOException(
                        "Atomic move unsupported and cleanup failed for: " + staged, e);
                compositeEx.addSuppressed(deleteEx);
                throw compositeEx;
            }
        }

        markAsOutput(staged);
        return target;
    }

    /**
     * Deletes tracked artifacts in reverse order (files before their staging directory).
     *
     * @throws CleanupException if any deletion fails; all failures are attached
     */
    @Override
    public void close() throws CleanupException {
        List<Path> reversed = new ArrayList<>(trackedFiles);
        Collections.reverse(reversed);
        List<IOException> failures = new ArrayList<>();

        for (Path artifact : reversed) {
            try {
                Files.deleteIfExists(artifact);
            } catch (IOException e) {
                failures.add(e);
                log.warn("Cleanup failed for staged file: {}", artifact, e);
            }
        }
        trackedFiles.clear();

        if (!failures.isEmpty()) {
            throw new CleanupException(
                    "Staging cleanup encountered " + failures.size() + " failure(s) in: " + stagingDir,
                    failures);
        }
    }
}
