package com.largomodo.photocollage.service;

import com.largomodo.photocollage.core.EncodedOutput;
import com.largomodo.photocollage.core.OutputFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PNG/JPEG encoding.
 * <p>
 * Verifies:
 * - PNG keeps the canvas alpha, JPEG is flattened onto white
 * - Resolution metadata (pHYs / JFIF density) carries the configured DPI
 */
class ImageIoExporterTest {

    private ImageIoExporter exporter;
    private BufferedImage canvas;

    @BeforeEach
    void setUp() {
        exporter = new ImageIoExporter();
        canvas = new BufferedImage(64, 64, BufferedImage.TYPE_INT_ARGB);
        for (int y = 16; y < 48; y++) {
            for (int x = 16; x < 48; x++) {
                canvas.setRGB(x, y, Color.BLUE.getRGB());
            }
        }
    }

    private static IIOMetadata readMetadata(byte[] data, String expectedFormat) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            assertTrue(readers.hasNext(), "no reader for encoded bytes");
            ImageReader reader = readers.next();
            try {
                assertEquals(expectedFormat, reader.getFormatName().toLowerCase());
                reader.setInput(in);
                return reader.getImageMetadata(0);
            } finally {
                reader.dispose();
            }
        }
    }

    private static Element findElement(Node node, String name) {
        if (name.equals(node.getNodeName())) {
            return (Element) node;
        }
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            Element found = findElement(child, name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static BufferedImage decode(byte[] data) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(data));
    }

    @Test
    void testExportsPngThenJpeg() {
        List<EncodedOutput> outputs = exporter.export(canvas, 300);

        assertEquals(2, outputs.size());
        assertEquals(OutputFormat.PNG, outputs.get(0).format());
        assertEquals(OutputFormat.JPEG, outputs.get(1).format());
        assertTrue(outputs.get(0).succeeded());
        assertTrue(outputs.get(1).succeeded());
    }

    @Test
    void testPngKeepsTransparency() throws IOException {
        byte[] png = exporter.export(canvas, 300).get(0).data();

        BufferedImage decoded = decode(png);

        assertTrue(decoded.getColorModel().hasAlpha());
        assertEquals(0, decoded.getRGB(2, 2) >>> 24);
        assertEquals(Color.BLUE.getRGB(), decoded.getRGB(32, 32));
    }

    @Test
    void testJpegIsFlattenedOntoWhite() throws IOException {
        byte[] jpeg = exporter.export(canvas, 300).get(1).data();

        BufferedImage decoded = decode(jpeg);

        assertFalse(decoded.getColorModel().hasAlpha());
        Color corner = new Color(decoded.getRGB(2, 2));
        assertTrue(corner.getRed() > 245 && corner.getGreen() > 245 && corner.getBlue() > 245,
                "transparent area should become white: " + corner);
        Color center = new Color(decoded.getRGB(32, 32));
        assertTrue(center.getBlue() > 230 && center.getRed() < 25, "blue survives compression: " + center);
    }

    @Test
    void testPngCarriesDpiAsPixelsPerMeter() throws IOException {
        byte[] png = exporter.export(canvas, 300).get(0).data();

        IIOMetadata metadata = readMetadata(png, "png");
        Element phys = findElement(metadata.getAsTree("javax_imageio_png_1.0"), "pHYs");

        assertNotNull(phys, "pHYs chunk missing");
        assertEquals("11811", phys.getAttribute("pixelsPerUnitXAxis"));
        assertEquals("11811", phys.getAttribute("pixelsPerUnitYAxis"));
        assertEquals("meter", phys.getAttribute("unitSpecifier"));
    }

    @Test
    void testJpegCarriesDpiInJfifHeader() throws IOException {
        byte[] jpeg = exporter.export(canvas, 150).get(1).data();

        IIOMetadata metadata = readMetadata(jpeg, "jpeg");
        Element jfif = findElement(metadata.getAsTree("javax_imageio_jpeg_image_1.0"), "app0JFIF");

        assertNotNull(jfif, "JFIF segment missing");
        assertEquals("1", jfif.getAttribute("resUnits"));
        assertEquals("150", jfif.getAttribute("Xdensity"));
        assertEquals("150", jfif.getAttribute("Ydensity"));
    }

    @Test
    void testFlattenCompositesPartialAlpha() {
        BufferedImage translucent = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        translucent.setRGB(0, 0, 0x80FF0000);

        BufferedImage flat = exporter.flatten(translucent);

        assertEquals(BufferedImage.TYPE_INT_RGB, flat.getType());
        Color mixed = new Color(flat.getRGB(0, 0));
        assertEquals(255, mixed.getRed());
        assertTrue(mixed.getGreen() > 120 && mixed.getGreen() < 135, "half red over white is pink: " + mixed);
        assertEquals(Color.WHITE.getRGB(), flat.getRGB(1, 1));
    }

    @Test
    void testInvalidArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> exporter.export(canvas, 0));
        assertThrows(IllegalArgumentException.class, () -> new ImageIoExporter(new Color(255, 255, 255, 10)));
        assertThrows(IllegalArgumentException.class, () -> new ImageIoExporter(null));
    }
}
