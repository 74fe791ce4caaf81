package com.largomodo.photocollage.core;

import com.largomodo.photocollage.core.domain.DecodedImage;
import com.largomodo.photocollage.core.domain.GridPlan;
import com.largomodo.photocollage.core.domain.GroupPartitioner;
import com.largomodo.photocollage.core.domain.ImageGroup;
import com.largomodo.photocollage.core.domain.LoadResult;
import com.largomodo.photocollage.render.CanvasComposer;
import com.largomodo.photocollage.render.ComposedCanvas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CollageProcessor with mocked decoding, composition and encoding.
 * <p>
 * Tests verify:
 * - Constructor injection with null checks
 * - Per-image failure isolation
 * - Export failure statuses (PARTIAL, FAILED) and staging cleanup
 * - Cancellation at group boundaries
 */
class CollageProcessorTest {

    private static final byte[] PNG_BYTES = {1, 2, 3};
    private static final byte[] JPEG_BYTES = {4, 5, 6};

    @TempDir
    Path tempDir;
    private ImageLoader mockLoader;
    private CanvasComposer mockComposer;
    private CollageExporter mockExporter;
    private GroupPartitioner partitioner;  // Real instance (stateless)
    private CollageProcessor processor;
    private CollageSettings settings;

    @BeforeEach
    void setUp() throws IOException {
        mockLoader = mock(ImageLoader.class);
        mockComposer = mock(CanvasComposer.class);
        mockExporter = mock(CollageExporter.class);
        partitioner = new GroupPartitioner();
        processor = new CollageProcessor(partitioner, mockLoader, mockComposer, mockExporter);
        settings = CollageSettings.builder().photosPerGroup(2).build();

        when(mockLoader.load(any(Path.class))).thenAnswer(inv ->
                new DecodedImage(inv.getArgument(0), new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB)));
        when(mockComposer.compose(anyList(), any(CollageSettings.class))).thenAnswer(inv -> {
            List<?> images = inv.getArgument(0);
            if (images.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new ComposedCanvas(new BufferedImage(8, 8, BufferedImage.TYPE_INT_ARGB),
                    new GridPlan(1, images.size()), images.size()));
        });
        when(mockExporter.export(any(BufferedImage.class), anyInt())).thenReturn(List.of(
                EncodedOutput.success(OutputFormat.PNG, PNG_BYTES),
                EncodedOutput.success(OutputFormat.JPEG, JPEG_BYTES)));
    }

    private static List<Path> sources(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> Path.of("photo" + i + ".jpg"))
                .collect(Collectors.toList());
    }

    private List<String> outputNames() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    void testConstructorRejectsNullDependencies() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                new CollageProcessor(null, mockLoader, mockComposer, mockExporter));
        assertEquals("All dependencies must not be null", ex.getMessage());

        assertThrows(IllegalArgumentException.class, () ->
                new CollageProcessor(partitioner, null, mockComposer, mockExporter));
        assertThrows(IllegalArgumentException.class, () ->
                new CollageProcessor(partitioner, mockLoader, null, mockExporter));
        assertThrows(IllegalArgumentException.class, () ->
                new CollageProcessor(partitioner, mockLoader, mockComposer, null));
    }

    @Test
    void testEmptySourceListIsFatal() {
        assertThrows(NoInputImagesException.class, () ->
                processor.process(List.of(), settings, tempDir, CollageObserver.NONE));
        verifyNoInteractions(mockLoader, mockComposer, mockExporter);
    }

    @Test
    void testWritesBothFormatsPerGroup() throws IOException {
        RunReport report = processor.process(sources(3), settings, tempDir, CollageObserver.NONE);

        assertEquals(2, report.groupCount());
        assertEquals(2, report.groupsWithOutput());
        assertFalse(report.cancelled());
        assertTrue(report.failedImages().isEmpty());
        assertEquals(List.of("collage_01.jpg", "collage_01.png", "collage_02.jpg", "collage_02.png"),
                outputNames(), "Staging directories must be gone after each group");

        assertArrayEquals(PNG_BYTES, Files.readAllBytes(tempDir.resolve("collage_01.png")));
        assertArrayEquals(JPEG_BYTES, Files.readAllBytes(tempDir.resolve("collage_02.jpg")));

        GroupOutcome second = report.outcomes().get(1);
        assertEquals(GroupOutcome.Status.EXPORTED, second.status());
        assertEquals(1, second.placedImages());
    }

    @Test
    void testCreatesMissingOutputDirectory() throws IOException {
        Path nested = tempDir.resolve("a").resolve("b");

        processor.process(sources(1), settings, nested, CollageObserver.NONE);

        assertTrue(Files.exists(nested.resolve("collage_01.png")));
    }

    @Test
    void testCorruptImageIsSkippedAndReported() throws IOException {
        Path bad = Path.of("photo2.jpg");
        when(mockLoader.load(bad)).thenThrow(new IOException("Unsupported or unrecognized image format"));
        CollageObserver observer = mock(CollageObserver.class);

        RunReport report = processor.process(sources(4), settings, tempDir, observer);

        assertEquals(List.of(bad), report.failedImages());
        assertEquals(1, report.outcomes().get(0).placedImages());
        assertEquals(GroupOutcome.Status.EXPORTED, report.outcomes().get(0).status());
        verify(observer).onImageFailed(eq(bad), any(IOException.class));
    }

    @Test
    void testRuntimeDecodeFailureIsIsolated() throws IOException {
        when(mockLoader.load(Path.of("photo1.jpg"))).thenThrow(new IllegalStateException("decoder crashed"));

        LoadResult result = processor.loadGroup(new ImageGroup(1, sources(2)), CollageObserver.NONE);

        assertEquals(1, result.images().size());
        assertEquals(List.of(Path.of("photo1.jpg")), result.failed());
    }

    @Test
    void testGroupWithoutDecodableImagesIsEmpty() throws IOException {
        when(mockLoader.load(any(Path.class))).thenThrow(new IOException("corrupt"));

        RunReport report = processor.process(sources(2), settings, tempDir, CollageObserver.NONE);

        GroupOutcome outcome = report.outcomes().get(0);
        assertEquals(GroupOutcome.Status.EMPTY, outcome.status());
        assertEquals(0, report.groupsWithOutput());
        assertEquals(1, report.emptyGroups());
        assertEquals(2, report.failedImages().size());
        verifyNoInteractions(mockExporter);
        assertTrue(outputNames().isEmpty());
    }

    @Test
    void testJpegFailureKeepsPngAsPartial() throws IOException {
        when(mockExporter.export(any(BufferedImage.class), anyInt())).thenReturn(List.of(
                EncodedOutput.success(OutputFormat.PNG, PNG_BYTES),
                EncodedOutput.failure(OutputFormat.JPEG, new IOException("encoder unavailable"))));

        RunReport report = processor.process(sources(1), settings, tempDir, CollageObserver.NONE);

        GroupOutcome outcome = report.outcomes().get(0);
        assertEquals(GroupOutcome.Status.PARTIAL, outcome.status());
        assertTrue(outcome.producedOutput());
        assertEquals(List.of(tempDir.resolve("collage_01.png")), outcome.writtenFiles());
        assertEquals(1, outcome.exportErrors().size());
        assertTrue(outcome.exportErrors().get(0).startsWith("collage_01.jpg"));
        assertEquals(List.of("collage_01.png"), outputNames());
    }

    @Test
    void testAllFormatsFailingMarksGroupFailed() throws IOException {
        when(mockExporter.export(any(BufferedImage.class), anyInt())).thenReturn(List.of(
                EncodedOutput.failure(OutputFormat.PNG, new IOException("disk full")),
                EncodedOutput.failure(OutputFormat.JPEG, new IOException("disk full"))));

        RunReport report = processor.process(sources(1), settings, tempDir, CollageObserver.NONE);

        assertEquals(GroupOutcome.Status.FAILED, report.outcomes().get(0).status());
        assertEquals(0, report.groupsWithOutput());
        assertEquals("Total collages generated: 0/1", report.summaryLines().get(0));
        assertTrue(outputNames().isEmpty());
    }

    @Test
    void testCompositionCrashFailsOnlyThatGroup() throws IOException {
        when(mockComposer.compose(anyList(), any(CollageSettings.class)))
                .thenThrow(new IllegalStateException("raster too large"))
                .thenAnswer(inv -> Optional.of(new ComposedCanvas(
                        new BufferedImage(8, 8, BufferedImage.TYPE_INT_ARGB), new GridPlan(1, 2), 2)));
        List<String> completed = new ArrayList<>();
        CollageObserver observer = new CollageObserver() {
            @Override
            public void onGroupComplete(GroupOutcome outcome) {
                completed.add(outcome.baseName() + " " + outcome.status());
            }
        };

        RunReport report = processor.process(sources(4), settings, tempDir, observer);

        assertEquals(List.of("collage_01 FAILED", "collage_02 EXPORTED"), completed);
        GroupOutcome first = report.outcomes().get(0);
        assertEquals(0, first.placedImages());
        assertEquals(1, first.exportErrors().size());
        assertTrue(first.exportErrors().get(0).contains("raster too large"));
        assertEquals(1, report.groupsWithOutput());
        assertEquals(List.of("collage_02.jpg", "collage_02.png"), outputNames());
        assertNull(MDC.get("group"));
    }

    @Test
    void testEncoderCrashFailsOnlyThatGroup() throws IOException {
        when(mockExporter.export(any(BufferedImage.class), anyInt()))
                .thenThrow(new IllegalArgumentException("Unsupported raster"))
                .thenReturn(List.of(
                        EncodedOutput.success(OutputFormat.PNG, PNG_BYTES),
                        EncodedOutput.success(OutputFormat.JPEG, JPEG_BYTES)));

        RunReport report = processor.process(sources(3), settings, tempDir, CollageObserver.NONE);

        assertEquals(GroupOutcome.Status.FAILED, report.outcomes().get(0).status());
        assertEquals(GroupOutcome.Status.EXPORTED, report.outcomes().get(1).status());
        assertEquals("Total collages generated: 1/2", report.summaryLines().get(0));
    }

    @Test
    void testExportReceivesConfiguredDpi() throws IOException {
        CollageSettings highDpi = settings.toBuilder().dpi(600).build();

        processor.process(sources(1), highDpi, tempDir, CollageObserver.NONE);

        verify(mockExporter).export(any(BufferedImage.class), eq(600));
    }

    @Test
    void testCancellationStopsAtGroupBoundary() throws IOException {
        AtomicInteger polls = new AtomicInteger();

        RunReport report = processor.process(sources(6), settings, tempDir, CollageObserver.NONE,
                () -> polls.incrementAndGet() > 1);

        assertTrue(report.cancelled());
        assertEquals(3, report.groupCount());
        assertEquals(1, report.groupsAttempted());
        assertEquals(List.of("collage_01.jpg", "collage_01.png"), outputNames());
    }

    @Test
    void testObserverSeesGroupsInOrder() throws IOException {
        List<String> events = new ArrayList<>();
        CollageObserver observer = new CollageObserver() {
            @Override
            public void onGroupStart(ImageGroup group, int groupCount) {
                events.add("start " + group.index() + "/" + groupCount);
            }

            @Override
            public void onGroupComplete(GroupOutcome outcome) {
                events.add("complete " + outcome.groupIndex() + " " + outcome.status());
            }
        };

        processor.process(sources(3), settings, tempDir, observer);

        assertEquals(List.of("start 1/2", "complete 1 EXPORTED", "start 2/2", "complete 2 EXPORTED"), events);
    }

    @Test
    void testGroupOrderPassedToComposer() throws IOException {
        processor.process(sources(2), settings, tempDir, CollageObserver.NONE);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DecodedImage>> captor = ArgumentCaptor.forClass(List.class);
        verify(mockComposer).compose(captor.capture(), eq(settings));
        assertEquals(sources(2), captor.getValue().stream().map(DecodedImage::source).collect(Collectors.toList()));
    }

    @Test
    void testMdcClearedAfterRun() throws IOException {
        processor.process(sources(1), settings, tempDir, CollageObserver.NONE);

        assertNull(MDC.get("group"));
    }
}
