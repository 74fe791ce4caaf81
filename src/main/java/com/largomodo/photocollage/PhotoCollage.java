package com.largomodo.photocollage;

import com.largomodo.photocollage.core.CollageExporter;
import com.largomodo.photocollage.core.CollageObserver;
import com.largomodo.photocollage.core.CollageProcessor;
import com.largomodo.photocollage.core.CollageSettings;
import com.largomodo.photocollage.core.CollageShape;
import com.largomodo.photocollage.core.GroupOutcome;
import com.largomodo.photocollage.core.ImageLoader;
import com.largomodo.photocollage.core.NoInputImagesException;
import com.largomodo.photocollage.core.RunReport;
import com.largomodo.photocollage.core.domain.GroupPartitioner;
import com.largomodo.photocollage.core.domain.SquareGridPlanner;
import com.largomodo.photocollage.render.CanvasComposer;
import com.largomodo.photocollage.render.CellRenderer;
import com.largomodo.photocollage.render.ShapeMask;
import com.largomodo.photocollage.service.ImageIoExporter;
import com.largomodo.photocollage.service.ImageIoLoader;
import com.largomodo.photocollage.util.ImageFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Point;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * CLI entry point for photo collage generation.
 * <p>
 * Uses Picocli for argument parsing with automatic help generation and type-safe validation.
 * Accepts one or more positional inputs: directories are scanned (non-recursively, sorted by
 * name) for image files, plain files are used as given. The resulting ordered list is split into
 * groups, and every group becomes one {@code collage_NN.png} / {@code collage_NN.jpg} pair.
 * <p>
 * Smart defaults:
 * - Directory as first input without -o: outputs to <input>/Auto-Generated-Collages
 * - File as first input without -o: outputs to ./Auto-Generated-Collages
 * - Explicit -o flag: overrides all defaults
 */
@Command(
        name = "photocollage",
        mixinStandardHelpOptions = true,
        resourceBundle = "photocollage.photocollage",
        version = "${bundle:application.version}",
        header = "Arranges batches of photos into shaped collage canvases.",
        description = {
                "Splits the input photos into groups, lays each group out on a near-square grid with" +
                        " cropped, rounded, shadowed cells, optionally cuts the canvas to a circle, heart or" +
                        " custom mask, and saves every collage as PNG (with transparency) and JPEG.",
                "",
                "Unreadable or corrupt photos are skipped and listed at the end of the run."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (no input images, I/O, etc.)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class PhotoCollage implements Callable<Integer> {

    static final String DEFAULT_OUTPUT_FOLDER = "Auto-Generated-Collages";

    private static final Logger log = LoggerFactory.getLogger(PhotoCollage.class);

    @Parameters(index = "0..*", arity = "1..*", paramLabel = "INPUT",
            description = {
                    "Photo files and/or directories containing photos.",
                    "Directories are scanned non-recursively for .jpg, .jpeg, .png, .gif, .bmp, .tif(f)" +
                            " and .webp files in name order; files are used in the order given."
            })
    List<File> inputPaths;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "The destination directory for generated collages.",
                    "If omitted, defaults to '" + DEFAULT_OUTPUT_FOLDER + "' inside the first input directory",
                    "(or inside the current directory when the first input is a file)."
            })
    File outputDir;

    @Option(names = {"-n", "--images-per-collage"}, defaultValue = "50",
            description = "Number of photos per collage (default: ${DEFAULT-VALUE})")
    int imagesPerCollage;

    @Option(names = {"-s", "--size"}, defaultValue = "3000x3000",
            converter = CliConverters.CanvasSizeConverter.class,
            description = "Canvas size WIDTHxHEIGHT in pixels (default: ${DEFAULT-VALUE})")
    Dimension canvasSize;

    @Option(names = "--dpi", defaultValue = "300",
            description = "Resolution stored in the output files (default: ${DEFAULT-VALUE})")
    int dpi;

    @Option(names = "--shape", defaultValue = "SQUARE",
            description = {
                    "Collage silhouette.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    CollageShape.Kind shape;

    @Option(names = "--custom-mask",
            description = "Greyscale mask image for the CUSTOM shape (implies --shape CUSTOM)")
    File customMask;

    @Option(names = "--frame", defaultValue = "20",
            description = "Outer frame thickness in pixels (default: ${DEFAULT-VALUE})")
    int frame;

    @Option(names = "--spacing", defaultValue = "5",
            description = "Spacing between photos in pixels (default: ${DEFAULT-VALUE})")
    int spacing;

    @Option(names = "--corner-radius", defaultValue = "10",
            description = "Rounded corner radius in pixels (default: ${DEFAULT-VALUE})")
    int cornerRadius;

    @Option(names = "--no-rounded-corners", description = "Disable rounded corners on photos")
    boolean noRoundedCorners;

    @Option(names = "--no-shadow", description = "Disable drop shadow on photos")
    boolean noShadow;

    @Option(names = "--shadow-offset", defaultValue = "5,5",
            converter = CliConverters.OffsetConverter.class,
            description = "Shadow offset DX,DY in pixels (default: ${DEFAULT-VALUE})")
    Point shadowOffset;

    @Option(names = "--shadow-blur", defaultValue = "10",
            description = "Shadow blur radius in pixels (default: ${DEFAULT-VALUE})")
    int shadowBlur;

    @Option(names = "--shadow-color", defaultValue = "#00000050",
            converter = CliConverters.ColorConverter.class,
            description = "Shadow colour #RRGGBB or #RRGGBBAA (default: ${DEFAULT-VALUE})")
    Color shadowColor;

    @Option(names = "--background", defaultValue = "#FFFFFFFF",
            converter = CliConverters.ColorConverter.class,
            description = "Canvas background #RRGGBB or #RRGGBBAA (default: ${DEFAULT-VALUE})")
    Color background;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = createCommandLine(new PhotoCollage()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the parser settings shared by {@link #main} and tests.
     */
    static CommandLine createCommandLine(PhotoCollage command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    /**
     * Output directory used when -o is absent: a folder inside the first input when it is a
     * directory, otherwise a folder in the working directory.
     */
    static File defaultOutputDir(File firstInput) {
        if (firstInput.isDirectory()) {
            return new File(firstInput, DEFAULT_OUTPUT_FOLDER);
        }
        return new File(DEFAULT_OUTPUT_FOLDER);
    }

    /**
     * Wires the production pipeline: ImageIO codecs, near-square grid, Java2D rendering.
     */
    static CollageProcessor createProcessor() {
        ImageLoader loader = new ImageIoLoader();
        CanvasComposer composer = new CanvasComposer(new SquareGridPlanner(), new CellRenderer(), new ShapeMask());
        CollageExporter exporter = new ImageIoExporter();
        return new CollageProcessor(new GroupPartitioner(), loader, composer, exporter);
    }

    /**
     * Expands the inputs into the ordered source list.
     * <p>
     * Directories contribute their image files sorted by name; unreadable entries are skipped
     * with a warning. Files are taken as given so a corrupt one is reported as a failure later.
     *
     * @param inputs files and directories in command-line order
     * @return ordered source references, possibly empty
     * @throws IOException if a directory cannot be listed at all
     */
    static List<Path> collectSources(List<File> inputs) throws IOException {
        List<Path> sources = new ArrayList<>();
        for (File input : inputs) {
            Path path = input.toPath();
            if (!Files.isDirectory(path)) {
                sources.add(path);
                continue;
            }

            int before = sources.size();
            try (Stream<Path> stream = Files.list(path)) {
                stream.filter(entry -> {
                            try {
                                return ImageFileMatcher.isImage(entry);
                            } catch (UncheckedIOException | SecurityException e) {
                                log.warn("WARNING: Cannot access {} - skipping", entry);
                                return false;
                            }
                        })
                        .sorted(Comparator.comparing(entry -> entry.getFileName().toString()))
                        .forEach(sources::add);
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            log.info("Found {} images in {}", sources.size() - before, path);
        }
        return sources;
    }

    /**
     * Builds the run configuration from the parsed options.
     *
     * @throws IllegalArgumentException if a value fails validation
     */
    CollageSettings buildSettings() {
        CollageShape.Kind kind = customMask != null ? CollageShape.Kind.CUSTOM : shape;
        return CollageSettings.builder()
                .canvasSize(canvasSize.width, canvasSize.height)
                .dpi(dpi)
                .backgroundColor(background)
                .frameThickness(frame)
                .spacing(spacing)
                .roundedCorners(!noRoundedCorners)
                .cornerRadius(cornerRadius)
                .dropShadow(!noShadow)
                .shadowOffset(shadowOffset.x, shadowOffset.y)
                .shadowBlur(shadowBlur)
                .shadowColor(shadowColor)
                .photosPerGroup(imagesPerCollage)
                .shape(kind.toShape(customMask != null ? customMask.toPath() : null))
                .build();
    }

    /**
     * Runs the pipeline with boundary-level cancellation on SIGINT.
     * <p>
     * The shutdown hook only raises the cancel flag and waits for the current group to finish
     * writing; groups already written stay on disk.
     */
    private static RunReport run(List<Path> sources, CollageSettings settings, Path outputRoot) throws IOException {
        CollageProcessor processor = createProcessor();
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);

        Thread shutdownHook = new Thread(() -> {
            if (finished.getCount() > 0) {
                log.info("Interrupt received, finishing current collage...");
                cancelRequested.set(true);
                try {
                    if (!finished.await(5, TimeUnit.MINUTES)) {
                        log.warn("Current collage did not finish in time");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        CollageObserver observer = new CollageObserver() {
            @Override
            public void onGroupComplete(GroupOutcome outcome) {
                if (outcome.status() == GroupOutcome.Status.FAILED) {
                    log.error("FAILED: {} - no output could be written", outcome.baseName());
                }
            }
        };

        try {
            return processor.process(sources, settings, outputRoot, observer, cancelRequested::get);
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM already shutting down; the hook is running and sees the latch released
                log.debug("Shutdown in progress, hook left registered");
            }
        }
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        for (File input : inputPaths) {
            if (!input.exists()) {
                throw new ParameterException(spec.commandLine(),
                        "Input path does not exist: " + input.getAbsolutePath());
            }
            if (!input.canRead()) {
                throw new ParameterException(spec.commandLine(),
                        "Input path is not readable (check permissions): " + input.getAbsolutePath());
            }
        }

        if (outputDir == null) {
            outputDir = defaultOutputDir(inputPaths.get(0));
        }

        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        if (outputDir.exists() && !outputDir.canWrite()) {
            throw new ParameterException(spec.commandLine(),
                    "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
        }

        CollageSettings settings;
        try {
            settings = buildSettings();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Invalid settings: " + e.getMessage(), e);
        }

        List<Path> sources = collectSources(inputPaths);

        RunReport report;
        try {
            report = run(sources, settings, outputDir.toPath());
        } catch (NoInputImagesException e) {
            log.error("ERROR: No images found in the specified input(s)");
            return 1;
        }

        log.info("Output folder: {}", outputDir.getAbsolutePath());
        report.summaryLines().forEach(log::info);
        return 0;
    }
}
