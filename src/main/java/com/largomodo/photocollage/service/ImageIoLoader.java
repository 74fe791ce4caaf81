package com.largomodo.photocollage.service;

import com.largomodo.photocollage.core.ImageLoader;
import com.largomodo.photocollage.core.domain.DecodedImage;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link ImageLoader} backed by ImageIO: the JDK codecs (JPEG, PNG, GIF, BMP, TIFF, WBMP) plus the
 * TwelveMonkeys WebP reader registered from the runtime classpath.
 * <p>
 * Every failure mode surfaces as {@link IOException} so callers isolate it per image:
 * missing/unreadable file, a stream no installed reader recognizes, a decoder that chokes on
 * corrupt data, or a zero-sized result. Whatever the source channel layout (grey, palette,
 * RGB, RGBA), the result is normalized to {@link BufferedImage#TYPE_INT_ARGB}.
 */
public class ImageIoLoader implements ImageLoader {

    @Override
    public DecodedImage load(Path source) throws IOException {
        if (source == null) {
            throw new IOException("Image reference is null");
        }
        if (!Files.isRegularFile(source)) {
            throw new IOException("Image file does not exist: " + source);
        }
        if (!Files.isReadable(source)) {
            throw new IOException("Image file is not readable (check permissions): " + source);
        }

        BufferedImage decoded;
        try (InputStream in = Files.newInputStream(source)) {
            decoded = ImageIO.read(in);
        } catch (IOException e) {
            throw new IOException("Failed to decode " + source + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Some ImageIO plugins signal malformed streams with unchecked exceptions
            throw new IOException("Corrupt image data in " + source + ": " + e, e);
        }

        if (decoded == null) {
            throw new IOException("Unsupported or unrecognized image format: " + source);
        }
        if (decoded.getWidth() <= 0 || decoded.getHeight() <= 0) {
            throw new IOException("Image has zero dimensions: " + source);
        }

        return new DecodedImage(source, toArgb(decoded));
    }

    private static BufferedImage toArgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        BufferedImage argb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }
}
