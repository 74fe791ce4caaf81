package com.largomodo.photocollage.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outer silhouette of a collage canvas.
 * <p>
 * Closed set of variants; each carries only the data it needs. Code that branches on the
 * silhouette switches over {@link #kind()} so the compiler flags a missing case.
 */
public sealed interface CollageShape
        permits CollageShape.Square, CollageShape.Rectangle, CollageShape.Circle,
        CollageShape.Heart, CollageShape.Custom {

    Kind kind();

    /**
     * True for silhouettes that leave every canvas pixel visible.
     */
    default boolean isFullCanvas() {
        return kind() == Kind.SQUARE || kind() == Kind.RECTANGLE;
    }

    static CollageShape square() {
        return new Square();
    }

    static CollageShape rectangle() {
        return new Rectangle();
    }

    static CollageShape circle() {
        return new Circle();
    }

    static CollageShape heart() {
        return new Heart();
    }

    static CollageShape custom(Path maskPath) {
        return new Custom(maskPath);
    }

    record Square() implements CollageShape {
        @Override
        public Kind kind() {
            return Kind.SQUARE;
        }
    }

    record Rectangle() implements CollageShape {
        @Override
        public Kind kind() {
            return Kind.RECTANGLE;
        }
    }

    record Circle() implements CollageShape {
        @Override
        public Kind kind() {
            return Kind.CIRCLE;
        }
    }

    record Heart() implements CollageShape {
        @Override
        public Kind kind() {
            return Kind.HEART;
        }
    }

    /**
     * Silhouette taken from an external single-channel image, stretched to the canvas.
     *
     * @param maskPath mask image; loaded lazily when the mask is applied
     */
    record Custom(Path maskPath) implements CollageShape {
        public Custom {
            Objects.requireNonNull(maskPath, "Custom shape requires a mask path");
        }

        @Override
        public Kind kind() {
            return Kind.CUSTOM;
        }
    }

    /**
     * Variant tags, used for command-line parsing and exhaustive switches.
     */
    enum Kind {
        SQUARE,
        RECTANGLE,
        CIRCLE,
        HEART,
        CUSTOM;

        public static Kind fromCliArgument(String arg) {
            if (arg == null) {
                throw new IllegalArgumentException(
                        "Shape argument cannot be null. Supported: SQUARE, RECTANGLE, CIRCLE, HEART, CUSTOM");
            }
            try {
                return valueOf(arg.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Invalid shape: " + arg + ". Supported: SQUARE, RECTANGLE, CIRCLE, HEART, CUSTOM");
            }
        }

        /**
         * Builds the variant for this tag. CUSTOM needs the mask path; the others ignore it.
         */
        public CollageShape toShape(Path maskPath) {
            return switch (this) {
                case SQUARE -> square();
                case RECTANGLE -> rectangle();
                case CIRCLE -> circle();
                case HEART -> heart();
                case CUSTOM -> {
                    if (maskPath == null) {
                        throw new IllegalArgumentException("Shape CUSTOM requires a mask image path");
                    }
                    yield custom(maskPath);
                }
            };
        }
    }
}
