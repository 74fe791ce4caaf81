package com.largomodo.photocollage.service;

import com.largomodo.photocollage.core.CollageExporter;
import com.largomodo.photocollage.core.EncodedOutput;
import com.largomodo.photocollage.core.OutputFormat;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * {@link CollageExporter} writing PNG and JPEG through ImageIO.
 * <p>
 * PNG keeps the canvas alpha untouched and records resolution in a {@code pHYs} chunk.
 * JPEG first flattens the canvas onto an opaque background (white by default) using the
 * canvas alpha, then encodes at quality 0.95 with the resolution in the JFIF header.
 * Each format is encoded independently; a failure is captured in its {@link EncodedOutput}.
 */
public class ImageIoExporter implements CollageExporter {

    static final float JPEG_QUALITY = 0.95f;

    private static final String PNG_NATIVE_FORMAT = "javax_imageio_png_1.0";
    private static final String JPEG_NATIVE_FORMAT = "javax_imageio_jpeg_image_1.0";
    private static final double METERS_PER_INCH = 0.0254;

    private final Color flattenBackground;

    public ImageIoExporter() {
        this(Color.WHITE);
    }

    /**
     * @param flattenBackground opaque colour the JPEG output is flattened onto
     */
    public ImageIoExporter(Color flattenBackground) {
        if (flattenBackground == null || flattenBackground.getAlpha() != 255) {
            throw new IllegalArgumentException("Flatten background must be an opaque colour");
        }
        this.flattenBackground = flattenBackground;
    }

    @Override
    public List<EncodedOutput> export(BufferedImage canvas, int dpi) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("DPI must be positive: " + dpi);
        }
        List<EncodedOutput> outputs = new ArrayList<>();
        for (OutputFormat format : OutputFormat.values()) {
            try {
                BufferedImage source = format.preservesAlpha() ? canvas : flatten(canvas);
                byte[] data = switch (format) {
                    case PNG -> encodePng(source, dpi);
                    case JPEG -> encodeJpeg(source, dpi);
                };
                outputs.add(EncodedOutput.success(format, data));
            } catch (IOException | RuntimeException e) {
                outputs.add(EncodedOutput.failure(format, e));
            }
        }
        return outputs;
    }

    /**
     * Composites the canvas over the opaque background, dropping alpha.
     */
    BufferedImage flatten(BufferedImage canvas) {
        BufferedImage rgb = new BufferedImage(canvas.getWidth(), canvas.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(flattenBackground);
            g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(canvas, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private byte[] encodePng(BufferedImage canvas, int dpi) throws IOException {
        ImageWriter writer = writerFor(OutputFormat.PNG);
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            IIOMetadata metadata = writer.getDefaultImageMetadata(
                    ImageTypeSpecifier.createFromRenderedImage(canvas), param);

            String pixelsPerMeter = Integer.toString((int) Math.round(dpi / METERS_PER_INCH));
            IIOMetadataNode physical = new IIOMetadataNode("pHYs");
            physical.setAttribute("pixelsPerUnitXAxis", pixelsPerMeter);
            physical.setAttribute("pixelsPerUnitYAxis", pixelsPerMeter);
            physical.setAttribute("unitSpecifier", "meter");
            IIOMetadataNode root = new IIOMetadataNode(PNG_NATIVE_FORMAT);
            root.appendChild(physical);
            metadata.mergeTree(PNG_NATIVE_FORMAT, root);

            return write(writer, new IIOImage(canvas, null, metadata), param);
        } finally {
            writer.dispose();
        }
    }

    private byte[] encodeJpeg(BufferedImage rgb, int dpi) throws IOException {
        ImageWriter writer = writerFor(OutputFormat.JPEG);
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);

            IIOMetadata metadata = writer.getDefaultImageMetadata(
                    ImageTypeSpecifier.createFromRenderedImage(rgb), param);
            setJfifDensity(metadata, dpi);

            return write(writer, new IIOImage(rgb, null, metadata), param);
        } finally {
            writer.dispose();
        }
    }

    private static void setJfifDensity(IIOMetadata metadata, int dpi) throws IIOInvalidTreeException {
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(JPEG_NATIVE_FORMAT);
        IIOMetadataNode jfif = (IIOMetadataNode) root.getElementsByTagName("app0JFIF").item(0);
        if (jfif == null) {
            throw new IIOInvalidTreeException("JPEG metadata has no JFIF marker segment", root);
        }
        jfif.setAttribute("resUnits", "1"); // dots per inch
        jfif.setAttribute("Xdensity", Integer.toString(dpi));
        jfif.setAttribute("Ydensity", Integer.toString(dpi));
        metadata.setFromTree(JPEG_NATIVE_FORMAT, root);
    }

    private static byte[] write(ImageWriter writer, IIOImage image, ImageWriteParam param) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(out);
            writer.write(null, image, param);
        }
        return bytes.toByteArray();
    }

    private static ImageWriter writerFor(OutputFormat format) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getImageIoName());
        if (!writers.hasNext()) {
            throw new IOException("No ImageIO writer found for " + format);
        }
        return writers.next();
    }
}
