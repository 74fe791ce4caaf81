package com.largomodo.photocollage.render;

import com.largomodo.photocollage.core.CollageShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Canvas-level silhouettes.
 * <p>
 * A mask is a single-channel image the size of the canvas; applying it replaces the canvas
 * alpha with the mask value, so pixels outside the silhouette become transparent but stay in
 * the buffer. Square and Rectangle produce no mask (fully opaque).
 */
public class ShapeMask {

    private static final Logger log = LoggerFactory.getLogger(ShapeMask.class);

    /** Points sampled along the heart curve, one per degree. */
    static final int HEART_SAMPLES = 360;

    /** Half-width of the heart curve in curve units ({@code 16 sin^3 t} peaks at 16; 18 leaves a border). */
    private static final double HEART_EXTENT = 18.0;

    /** Heart anchor as a fraction of canvas height. */
    private static final double HEART_VERTICAL_ANCHOR = 0.45;

    /**
     * Builds the mask for a silhouette.
     *
     * @param shape  silhouette variant
     * @param width  canvas width
     * @param height canvas height
     * @return {@link BufferedImage#TYPE_BYTE_GRAY} mask, or empty when every pixel stays visible
     *         (Square, Rectangle, or a Custom mask that could not be loaded)
     */
    public Optional<BufferedImage> createMask(CollageShape shape, int width, int height) {
        return switch (shape.kind()) {
            case SQUARE, RECTANGLE -> Optional.empty();
            case CIRCLE -> Optional.of(circleMask(width, height));
            case HEART -> Optional.of(heartMask(width, height));
            case CUSTOM -> customMask(((CollageShape.Custom) shape).maskPath(), width, height);
        };
    }

    /**
     * Applies the silhouette to a finished canvas in place.
     *
     * @param canvas ARGB canvas
     * @param shape  silhouette variant
     * @return true if a mask was applied
     */
    public boolean apply(BufferedImage canvas, CollageShape shape) {
        Optional<BufferedImage> mask = createMask(shape, canvas.getWidth(), canvas.getHeight());
        if (mask.isEmpty()) {
            return false;
        }

        int width = canvas.getWidth();
        int height = canvas.getHeight();
        int[] pixels = canvas.getRGB(0, 0, width, height, null, 0, width);
        Raster maskRaster = mask.get().getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                pixels[i] = (maskRaster.getSample(x, y, 0) << 24) | (pixels[i] & 0x00FFFFFF);
            }
        }
        canvas.setRGB(0, 0, width, height, pixels, 0, width);
        return true;
    }

    /**
     * Outline of the heart silhouette:
     * {@code x = 16 sin^3 t}, {@code y = -(13 cos t - 5 cos 2t - 2 cos 3t - cos 4t)}, one sample per
     * degree, scaled by {@code min(W, H) / 2 / 18}, centred horizontally and anchored at 45% of the
     * height.
     */
    static Polygon heartOutline(int width, int height) {
        int centerX = width / 2;
        int anchorY = (int) (height * HEART_VERTICAL_ANCHOR);
        double scale = Math.min(width, height) / 2.0;

        Polygon outline = new Polygon();
        for (int i = 0; i < HEART_SAMPLES; i++) {
            double t = Math.toRadians(i);
            double x = 16 * Math.pow(Math.sin(t), 3);
            double y = -(13 * Math.cos(t) - 5 * Math.cos(2 * t) - 2 * Math.cos(3 * t) - Math.cos(4 * t));
            outline.addPoint(
                    centerX + (int) (x * scale / HEART_EXTENT),
                    anchorY + (int) (y * scale / HEART_EXTENT));
        }
        return outline;
    }

    private static BufferedImage circleMask(int width, int height) {
        int radius = Math.min(width, height) / 2;
        int centerX = width / 2;
        int centerY = height / 2;

        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = maskGraphics(mask);
        try {
            g.fill(new Ellipse2D.Double(centerX - radius, centerY - radius, 2.0 * radius, 2.0 * radius));
        } finally {
            g.dispose();
        }
        return mask;
    }

    private static BufferedImage heartMask(int width, int height) {
        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = maskGraphics(mask);
        try {
            g.fillPolygon(heartOutline(width, height));
        } finally {
            g.dispose();
        }
        return mask;
    }

    private static Optional<BufferedImage> customMask(Path maskPath, int width, int height) {
        try {
            BufferedImage source = ImageIO.read(maskPath.toFile());
            if (source == null) {
                throw new IOException("Not a supported image format: " + maskPath);
            }
            return Optional.of(toLuminance(Resampler.resize(toGray(source), width, height)));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not load custom mask {}, using rectangle: {}", maskPath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Converts to an opaque grey ARGB image using ITU-R 601 luma (299/587/114); source alpha is ignored.
     */
    private static BufferedImage toGray(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        int[] pixels = source.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            int r = (pixels[i] >> 16) & 0xFF;
            int g = (pixels[i] >> 8) & 0xFF;
            int b = pixels[i] & 0xFF;
            int luma = (r * 299 + g * 587 + b * 114 + 500) / 1000;
            pixels[i] = 0xFF000000 | (luma << 16) | (luma << 8) | luma;
        }
        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        gray.setRGB(0, 0, width, height, pixels, 0, width);
        return gray;
    }

    private static BufferedImage toLuminance(BufferedImage grayArgb) {
        int width = grayArgb.getWidth();
        int height = grayArgb.getHeight();
        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        int[] pixels = grayArgb.getRGB(0, 0, width, height, null, 0, width);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                // Red carries the luma of an opaque grey pixel
                mask.getRaster().setSample(x, y, 0, (pixels[y * width + x] >> 16) & 0xFF);
            }
        }
        return mask;
    }

    private static Graphics2D maskGraphics(BufferedImage mask) {
        Graphics2D g = mask.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setColor(Color.WHITE);
        return g;
    }
}
