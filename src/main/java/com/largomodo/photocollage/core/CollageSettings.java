package com.largomodo.photocollage.core;

import java.awt.Color;

/**
 * Immutable configuration for one collage run.
 * <p>
 * Built once per run through {@link #builder()} and validated in the compact constructor.
 * Defaults mirror the original batch tool: 3000x3000 canvas at 300 DPI on opaque white,
 * 20px frame, 5px spacing, 10px rounded corners, a (5,5) drop shadow blurred by 10px in
 * black at alpha 80, 50 photos per collage, square silhouette.
 *
 * @param canvasWidth         canvas width in pixels (&gt; 0)
 * @param canvasHeight        canvas height in pixels (&gt; 0)
 * @param dpi                 resolution written to exported files (&gt; 0)
 * @param backgroundColor     canvas fill, alpha honoured
 * @param frameThickness      outer margin around the grid (&gt;= 0)
 * @param spacing             gap between neighbouring cells (&gt;= 0)
 * @param roundedCorners      whether cells get rounded corners
 * @param cornerRadius        corner radius in pixels (&gt;= 0)
 * @param dropShadow          whether cells get a drop shadow
 * @param shadowOffsetX       horizontal shadow offset, may be negative
 * @param shadowOffsetY       vertical shadow offset, may be negative
 * @param shadowBlur          shadow blur radius (&gt;= 0)
 * @param shadowColor         shadow color, alpha honoured
 * @param photosPerGroup      photos placed on each canvas (&gt; 0)
 * @param shape               outer silhouette
 */
public record CollageSettings(
        int canvasWidth,
        int canvasHeight,
        int dpi,
        Color backgroundColor,
        int frameThickness,
        int spacing,
        boolean roundedCorners,
        int cornerRadius,
        boolean dropShadow,
        int shadowOffsetX,
        int shadowOffsetY,
        int shadowBlur,
        Color shadowColor,
        int photosPerGroup,
        CollageShape shape
) {

    public static final int DEFAULT_CANVAS_SIZE = 3000;
    public static final int DEFAULT_DPI = 300;
    public static final int DEFAULT_FRAME = 20;
    public static final int DEFAULT_SPACING = 5;
    public static final int DEFAULT_CORNER_RADIUS = 10;
    public static final int DEFAULT_SHADOW_OFFSET = 5;
    public static final int DEFAULT_SHADOW_BLUR = 10;
    public static final int DEFAULT_PHOTOS_PER_GROUP = 50;
    public static final Color DEFAULT_BACKGROUND = new Color(255, 255, 255, 255);
    public static final Color DEFAULT_SHADOW_COLOR = new Color(0, 0, 0, 80);

    public CollageSettings {
        requirePositive("canvasWidth", canvasWidth);
        requirePositive("canvasHeight", canvasHeight);
        requirePositive("dpi", dpi);
        requirePositive("photosPerGroup", photosPerGroup);
        requireNonNegative("frameThickness", frameThickness);
        requireNonNegative("spacing", spacing);
        requireNonNegative("cornerRadius", cornerRadius);
        requireNonNegative("shadowBlur", shadowBlur);
        if (backgroundColor == null || shadowColor == null) {
            throw new IllegalArgumentException("Colors must not be null");
        }
        if (shape == null) {
            throw new IllegalArgumentException("Shape must not be null");
        }
    }

    public static CollageSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Extra border each rendered cell needs to fit its shadow:
     * {@code blur + max(|dx|, |dy|)} when shadows are on, otherwise 0.
     */
    public int shadowMargin() {
        if (!dropShadow) {
            return 0;
        }
        return shadowBlur + Math.max(Math.abs(shadowOffsetX), Math.abs(shadowOffsetY));
    }

    public Builder toBuilder() {
        return new Builder()
                .canvasSize(canvasWidth, canvasHeight)
                .dpi(dpi)
                .backgroundColor(backgroundColor)
                .frameThickness(frameThickness)
                .spacing(spacing)
                .roundedCorners(roundedCorners)
                .cornerRadius(cornerRadius)
                .dropShadow(dropShadow)
                .shadowOffset(shadowOffsetX, shadowOffsetY)
                .shadowBlur(shadowBlur)
                .shadowColor(shadowColor)
                .photosPerGroup(photosPerGroup)
                .shape(shape);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
    }

    public static final class Builder {
        private int canvasWidth = DEFAULT_CANVAS_SIZE;
        private int canvasHeight = DEFAULT_CANVAS_SIZE;
        private int dpi = DEFAULT_DPI;
        private Color backgroundColor = DEFAULT_BACKGROUND;
        private int frameThickness = DEFAULT_FRAME;
        private int spacing = DEFAULT_SPACING;
        private boolean roundedCorners = true;
        private int cornerRadius = DEFAULT_CORNER_RADIUS;
        private boolean dropShadow = true;
        private int shadowOffsetX = DEFAULT_SHADOW_OFFSET;
        private int shadowOffsetY = DEFAULT_SHADOW_OFFSET;
        private int shadowBlur = DEFAULT_SHADOW_BLUR;
        private Color shadowColor = DEFAULT_SHADOW_COLOR;
        private int photosPerGroup = DEFAULT_PHOTOS_PER_GROUP;
        private CollageShape shape = CollageShape.square();

        private Builder() {
        }

        public Builder canvasSize(int width, int height) {
            this.canvasWidth = width;
            this.canvasHeight = height;
            return this;
        }

        public Builder dpi(int dpi) {
            this.dpi = dpi;
            return this;
        }

        public Builder backgroundColor(Color backgroundColor) {
            this.backgroundColor = backgroundColor;
            return this;
        }

        public Builder frameThickness(int frameThickness) {
            this.frameThickness = frameThickness;
            return this;
        }

        public Builder spacing(int spacing) {
            this.spacing = spacing;
            return this;
        }

        public Builder roundedCorners(boolean roundedCorners) {
            this.roundedCorners = roundedCorners;
            return this;
        }

        public Builder cornerRadius(int cornerRadius) {
            this.cornerRadius = cornerRadius;
            return this;
        }

        public Builder dropShadow(boolean dropShadow) {
            this.dropShadow = dropShadow;
            return this;
        }

        public Builder shadowOffset(int dx, int dy) {
            this.shadowOffsetX = dx;
            this.shadowOffsetY = dy;
            return this;
        }

        public Builder shadowBlur(int shadowBlur) {
            this.shadowBlur = shadowBlur;
            return this;
        }

        public Builder shadowColor(Color shadowColor) {
            this.shadowColor = shadowColor;
            return this;
        }

        public Builder photosPerGroup(int photosPerGroup) {
            this.photosPerGroup = photosPerGroup;
            return this;
        }

        public Builder shape(CollageShape shape) {
            this.shape = shape;
            return this;
        }

        public CollageSettings build() {
            return new CollageSettings(canvasWidth, canvasHeight, dpi, backgroundColor,
                    frameThickness, spacing, roundedCorners, cornerRadius,
                    dropShadow, shadowOffsetX, shadowOffsetY, shadowBlur, shadowColor,
                    photosPerGroup, shape);
        }
    }
}
