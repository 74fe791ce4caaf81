package com.largomodo.photocollage.render;

import java.awt.image.BufferedImage;

/**
 * Separable Gaussian blur of an ARGB image's alpha channel.
 * <p>
 * Used for shadows, whose colour is uniform: blurring coverage alone gives the same result as
 * blurring premultiplied colour at a fraction of the cost. The kernel spans {@code radius}
 * pixels on each side with {@code sigma = radius / 2}, so blurred coverage never reaches past
 * the margin reserved for it. Pixels outside the image count as fully transparent.
 */
public final class GaussianBlur {

    private GaussianBlur() {
        // Static utility class - prevent instantiation
    }

    /**
     * Blurs the alpha channel, leaving RGB untouched.
     *
     * @param source {@link BufferedImage#TYPE_INT_ARGB} image
     * @param radius kernel half-width in pixels; 0 returns the source unchanged
     * @return blurred copy, or {@code source} when radius is 0
     */
    public static BufferedImage blurAlpha(BufferedImage source, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Blur radius cannot be negative: " + radius);
        }
        if (radius == 0) {
            return source;
        }

        int width = source.getWidth();
        int height = source.getHeight();
        int[] argb = source.getRGB(0, 0, width, height, null, 0, width);
        double[] kernel = kernel(radius);

        double[] alpha = new double[width * height];
        for (int i = 0; i < argb.length; i++) {
            alpha[i] = argb[i] >>> 24;
        }

        double[] horizontal = new double[alpha.length];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    int sx = x + k;
                    if (sx >= 0 && sx < width) {
                        sum += alpha[row + sx] * kernel[k + radius];
                    }
                }
                horizontal[row + x] = sum;
            }
        }

        int[] result = new int[argb.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    int sy = y + k;
                    if (sy >= 0 && sy < height) {
                        sum += horizontal[sy * width + x] * kernel[k + radius];
                    }
                }
                int a = (int) Math.min(255, Math.round(sum));
                int i = y * width + x;
                result[i] = (a << 24) | (argb[i] & 0x00FFFFFF);
            }
        }

        BufferedImage blurred = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        blurred.setRGB(0, 0, width, height, result, 0, width);
        return blurred;
    }

    /**
     * Normalized 1-D Gaussian weights of length {@code 2 * radius + 1}.
     */
    static double[] kernel(int radius) {
        double sigma = radius / 2.0;
        double[] weights = new double[2 * radius + 1];
        double total = 0;
        for (int i = -radius; i <= radius; i++) {
            double w = Math.exp(-(i * i) / (2 * sigma * sigma));
            weights[i + radius] = w;
            total += w;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= total;
        }
        return weights;
    }
}
