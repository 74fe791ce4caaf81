package com.largomodo.photocollage.core;

import com.largomodo.photocollage.core.domain.DecodedImage;
import com.largomodo.photocollage.core.domain.GroupPartitioner;
import com.largomodo.photocollage.core.domain.ImageGroup;
import com.largomodo.photocollage.core.domain.LoadResult;
import com.largomodo.photocollage.core.workspace.CleanupException;
import com.largomodo.photocollage.core.workspace.OutputWorkspace;
import com.largomodo.photocollage.render.CanvasComposer;
import com.largomodo.photocollage.render.ComposedCanvas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Collage generation pipeline orchestrator.
 * <p>
 * Coordinates the run:
 * 1. Partition the ordered sources into groups
 * 2. For each group: load, compose, export, write {@code collage_NN.png} and {@code collage_NN.jpg}
 * 3. Collect outcomes and decode failures into a {@link RunReport}
 * <p>
 * Groups run strictly in sequence on the calling thread; a group's images and canvas are
 * released before the next group loads, so peak memory is one canvas plus one group of photos.
 * Failures stay inside the smallest affected unit: a bad image is skipped, an empty group is
 * skipped, a failed format does not stop the other. Only an empty source list aborts the run.
 * <p>
 * Holds no per-run state: one instance may serve concurrent runs, each with its own settings,
 * observer and output directory.
 */
public class CollageProcessor {

    private static final Logger log = LoggerFactory.getLogger(CollageProcessor.class);

    private final GroupPartitioner partitioner;
    private final ImageLoader loader;
    private final CanvasComposer composer;
    private final CollageExporter exporter;

    public CollageProcessor(GroupPartitioner partitioner, ImageLoader loader,
                            CanvasComposer composer, CollageExporter exporter) {
        if (partitioner == null || loader == null || composer == null || exporter == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.partitioner = partitioner;
        this.loader = loader;
        this.composer = composer;
        this.exporter = exporter;
    }

    /**
     * Runs the whole pipeline without cancellation.
     *
     * @see #process(List, CollageSettings, Path, CollageObserver, BooleanSupplier)
     */
    public RunReport process(List<Path> sources, CollageSettings settings, Path outputDir,
                             CollageObserver observer) throws IOException {
        return process(sources, settings, outputDir, observer, () -> false);
    }

    /**
     * Runs the whole pipeline.
     *
     * @param sources   ordered image references; order is preserved into the collages
     * @param settings  run configuration
     * @param outputDir directory receiving the collage files (created if missing)
     * @param observer  lifecycle callbacks
     * @param cancelled polled before each group; once true, no further group starts
     * @return run outcome including every decode failure
     * @throws NoInputImagesException if {@code sources} is empty
     * @throws IOException            if the output directory cannot be created
     */
    public RunReport process(List<Path> sources, CollageSettings settings, Path outputDir,
                             CollageObserver observer, BooleanSupplier cancelled) throws IOException {
        if (sources == null || sources.isEmpty()) {
            throw new NoInputImagesException("No input images to process");
        }

        List<ImageGroup> groups = partitioner.partition(sources, settings.photosPerGroup());
        log.info("Split {} images into {} group(s) ({} images per collage)",
                sources.size(), groups.size(), settings.photosPerGroup());

        Files.createDirectories(outputDir);

        List<GroupOutcome> outcomes = new ArrayList<>();
        List<Path> failedImages = new ArrayList<>();
        boolean wasCancelled = false;

        for (ImageGroup group : groups) {
            if (cancelled.getAsBoolean()) {
                log.info("Cancellation requested, stopping before collage {}/{}", group.index(), groups.size());
                wasCancelled = true;
                break;
            }

            MDC.put("group", group.baseName());
            try {
                observer.onGroupStart(group, groups.size());
                log.info("Processing collage {}/{}...", group.index(), groups.size());

                GroupOutcome outcome = processGroup(group, settings, outputDir, observer);
                failedImages.addAll(outcome.failedSources());
                outcomes.add(outcome);
                observer.onGroupComplete(outcome);
            } finally {
                MDC.remove("group");
            }
        }

        return new RunReport(groups.size(), outcomes, failedImages, wasCancelled);
    }

    /**
     * Decodes every source of a group, isolating failures per image.
     */
    LoadResult loadGroup(ImageGroup group, CollageObserver observer) {
        List<DecodedImage> images = new ArrayList<>();
        List<Path> failed = new ArrayList<>();

        for (Path source : group.sources()) {
            try {
                images.add(loader.load(source));
            } catch (IOException | RuntimeException e) {
                // Skip the image, the group carries on with the rest
                log.error("FAILED: {} - {}", source, e.getMessage());
                failed.add(source);
                observer.onImageFailed(source, e);
            }
        }
        return new LoadResult(images, failed);
    }

    private GroupOutcome processGroup(ImageGroup group, CollageSettings settings, Path outputDir,
                                      CollageObserver observer) {
        LoadResult loaded = loadGroup(group, observer);
        try {
            return composeAndExport(group, loaded, settings, outputDir);
        } catch (RuntimeException e) {
            // Drop this collage, the run carries on with the next group
            String message = group.baseName() + ": " + e;
            log.error("FAILED: {}", message);
            return new GroupOutcome(group.index(), group.baseName(), GroupOutcome.Status.FAILED,
                    0, loaded.failed(), List.of(), List.of(message));
        }
    }

    private GroupOutcome composeAndExport(ImageGroup group, LoadResult loaded, CollageSettings settings,
                                          Path outputDir) {
        Optional<ComposedCanvas> composed = composer.compose(loaded.images(), settings);
        if (composed.isEmpty()) {
            log.warn("No valid images for collage {}, skipping", group.index());
            return new GroupOutcome(group.index(), group.baseName(), GroupOutcome.Status.EMPTY,
                    0, loaded.failed(), List.of(), List.of());
        }

        ComposedCanvas canvas = composed.get();
        log.info("Collage {}: {} images in {}x{} grid", group.index(), canvas.placedImages(),
                canvas.grid().rows(), canvas.grid().cols());

        List<EncodedOutput> encoded = exporter.export(canvas.image(), settings.dpi());

        List<Path> written = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        try (OutputWorkspace workspace = new OutputWorkspace(outputDir, group.baseName(),
                UUID.randomUUID().toString())) {
            for (EncodedOutput output : encoded) {
                String fileName = output.format().fileName(group.baseName());
                if (!output.succeeded()) {
                    recordExportFailure(errors, fileName, output.error());
                    continue;
                }
                try {
                    Path finalPath = workspace.promote(workspace.stage(fileName, output.data()));
                    written.add(finalPath);
                    log.info("Saved: {}", finalPath);
                } catch (IOException e) {
                    recordExportFailure(errors, fileName, e);
                }
            }
        } catch (CleanupException e) {
            // Final files are already in place; leftover staging files are only clutter
            log.warn("Could not remove staging files for {}: {}", group.baseName(), e.getMessage());
        }

        GroupOutcome.Status status;
        if (errors.isEmpty()) {
            status = GroupOutcome.Status.EXPORTED;
        } else if (!written.isEmpty()) {
            status = GroupOutcome.Status.PARTIAL;
        } else {
            status = GroupOutcome.Status.FAILED;
        }

        return new GroupOutcome(group.index(), group.baseName(), status, canvas.placedImages(),
                loaded.failed(), written, errors);
    }

    private static void recordExportFailure(List<String> errors, String fileName, Exception e) {
        String message = fileName + ": " + e.getMessage();
        errors.add(message);
        log.error("FAILED: {}", message);
    }
}
