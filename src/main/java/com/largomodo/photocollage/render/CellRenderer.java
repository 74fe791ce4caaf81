package com.largomodo.photocollage.render;

import com.largomodo.photocollage.core.CollageSettings;
import com.largomodo.photocollage.core.domain.DecodedImage;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.Arrays;

/**
 * Turns one decoded photo into the decorated content placed in a grid cell.
 * <p>
 * Pipeline per photo: {@link #smartCrop} to the content size, optional {@link #roundCorners},
 * optional {@link #dropShadow}. The shadow step grows the image, so callers must place the
 * returned image by its own size, not by the requested content size.
 * <p>
 * Stateless: one instance can serve any number of groups.
 */
public class CellRenderer {

    /** Content edge used when shadow margin leaves no room in a cell. */
    public static final int MIN_CONTENT_SIZE = 10;

    /** Margin reserved per side when the configured shadow margin does not fit. */
    public static final int FALLBACK_SHADOW_MARGIN = 5;

    /**
     * Content size available inside a cell once the shadow margin is reserved on both sides.
     * <p>
     * When either axis would be &lt;= 0 the whole size falls back to
     * {@code max(10, cell - 2 * 5)} per axis instead of failing.
     *
     * @param cellWidth    cell width
     * @param cellHeight   cell height
     * @param shadowMargin margin from {@link CollageSettings#shadowMargin()}
     * @return content size, both axes &gt;= 1
     */
    public static Dimension contentSize(int cellWidth, int cellHeight, int shadowMargin) {
        int width = cellWidth - 2 * shadowMargin;
        int height = cellHeight - 2 * shadowMargin;
        if (width <= 0 || height <= 0) {
            width = Math.max(MIN_CONTENT_SIZE, cellWidth - 2 * FALLBACK_SHADOW_MARGIN);
            height = Math.max(MIN_CONTENT_SIZE, cellHeight - 2 * FALLBACK_SHADOW_MARGIN);
        }
        return new Dimension(width, height);
    }

    /**
     * Renders a photo for a cell using the decoration settings of the run.
     *
     * @param image   decoded source photo
     * @param content content size from {@link #contentSize}
     * @param settings run configuration (corners and shadow)
     * @return ARGB image; larger than {@code content} when a shadow is applied
     */
    public BufferedImage render(DecodedImage image, Dimension content, CollageSettings settings) {
        BufferedImage cell = smartCrop(image.pixels(), content.width, content.height);

        if (settings.roundedCorners()) {
            cell = roundCorners(cell, settings.cornerRadius());
        }

        if (settings.dropShadow()) {
            cell = dropShadow(cell, settings.shadowOffsetX(), settings.shadowOffsetY(),
                    settings.shadowBlur(), settings.shadowColor());
        }

        return cell;
    }

    /**
     * Center-crops the source to the target aspect ratio, then resamples to exactly the target size.
     * <p>
     * A source wider than the target ratio loses columns equally on both sides; a taller one
     * loses rows. At least one source pixel is always kept, so extreme ratios (1x1000) still work.
     *
     * @param source any image
     * @param width  target width (&gt; 0)
     * @param height target height (&gt; 0)
     * @return ARGB image of exactly {@code width x height}
     */
    public BufferedImage smartCrop(BufferedImage source, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + width + "x" + height);
        }

        int sourceWidth = source.getWidth();
        int sourceHeight = source.getHeight();
        double sourceRatio = (double) sourceWidth / sourceHeight;
        double targetRatio = (double) width / height;

        BufferedImage cropped;
        if (sourceRatio > targetRatio) {
            int newWidth = Math.max(1, (int) (sourceHeight * targetRatio));
            int left = (sourceWidth - newWidth) / 2;
            cropped = source.getSubimage(left, 0, newWidth, sourceHeight);
        } else {
            int newHeight = Math.max(1, (int) (sourceWidth / targetRatio));
            int top = (sourceHeight - newHeight) / 2;
            cropped = source.getSubimage(0, top, sourceWidth, newHeight);
        }

        return Resampler.resize(cropped, width, height);
    }

    /**
     * Replaces the image's alpha with an opaque rounded-rectangle mask.
     * <p>
     * Radius 0 returns the image unchanged. A radius of half the shorter side or more clamps
     * to a pill or ellipse shape.
     *
     * @param source ARGB image
     * @param radius corner radius in pixels (&gt;= 0)
     * @return new ARGB image, or {@code source} when radius is 0
     */
    public BufferedImage roundCorners(BufferedImage source, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Corner radius cannot be negative: " + radius);
        }
        if (radius == 0) {
            return source;
        }

        int width = source.getWidth();
        int height = source.getHeight();

        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = mask.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            // Arc size is the corner diameter; Java2D clamps it to the rectangle's sides
            g.fill(new RoundRectangle2D.Double(0, 0, width, height, 2.0 * radius, 2.0 * radius));
        } finally {
            g.dispose();
        }

        return replaceAlpha(source, mask);
    }

    /**
     * Adds a blurred drop shadow in the shape of the image's own alpha.
     * <p>
     * Output size is {@code (w + |dx| + 2*blur, h + |dy| + 2*blur)}. The silhouette sits at
     * {@code (blur + max(0, dx), blur + max(0, dy))}, is blurred by {@code blur}, and the image
     * is composited over it at {@code (blur + max(0, -dx), blur + max(0, -dy))}.
     *
     * @param source ARGB image, usually already corner-rounded
     * @param dx     horizontal offset of the shadow
     * @param dy     vertical offset of the shadow
     * @param blur   blur radius (&gt;= 0)
     * @param color  shadow colour; its alpha scales the silhouette
     * @return new, larger ARGB image
     */
    public BufferedImage dropShadow(BufferedImage source, int dx, int dy, int blur, Color color) {
        if (blur < 0) {
            throw new IllegalArgumentException("Shadow blur cannot be negative: " + blur);
        }

        int width = source.getWidth();
        int height = source.getHeight();
        int outWidth = width + Math.abs(dx) + 2 * blur;
        int outHeight = height + Math.abs(dy) + 2 * blur;

        int shadowX = blur + Math.max(0, dx);
        int shadowY = blur + Math.max(0, dy);
        int rgb = color.getRGB() & 0x00FFFFFF;
        int colorAlpha = color.getAlpha();

        int[] sourcePixels = source.getRGB(0, 0, width, height, null, 0, width);
        int[] silhouette = new int[outWidth * outHeight];
        Arrays.fill(silhouette, rgb);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int sourceAlpha = sourcePixels[y * width + x] >>> 24;
                int alpha = (sourceAlpha * colorAlpha + 127) / 255;
                silhouette[(shadowY + y) * outWidth + shadowX + x] = (alpha << 24) | rgb;
            }
        }

        BufferedImage shadow = new BufferedImage(outWidth, outHeight, BufferedImage.TYPE_INT_ARGB);
        shadow.setRGB(0, 0, outWidth, outHeight, silhouette, 0, outWidth);
        BufferedImage result = GaussianBlur.blurAlpha(shadow, blur);

        Graphics2D g = result.createGraphics();
        try {
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(source, blur + Math.max(0, -dx), blur + Math.max(0, -dy), null);
        } finally {
            g.dispose();
        }
        return result;
    }

    private static BufferedImage replaceAlpha(BufferedImage source, BufferedImage mask) {
        int width = source.getWidth();
        int height = source.getHeight();
        int[] pixels = source.getRGB(0, 0, width, height, null, 0, width);
        Raster maskRaster = mask.getRaster();

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                int alpha = maskRaster.getSample(x, y, 0);
                pixels[i] = (alpha << 24) | (pixels[i] & 0x00FFFFFF);
            }
        }

        BufferedImage output = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        output.setRGB(0, 0, width, height, pixels, 0, width);
        return output;
    }
}
