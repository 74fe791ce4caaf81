package com.largomodo.photocollage;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Point;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picocli converters for the collage options that are not plain numbers.
 */
final class CliConverters {

    private CliConverters() {
        // Static holder - prevent instantiation
    }

    /**
     * Parses {@code WIDTHxHEIGHT}, e.g. {@code 3000x2000}.
     */
    static class CanvasSizeConverter implements ITypeConverter<Dimension> {
        private static final Pattern SIZE = Pattern.compile("(\\d+)\\s*[xX]\\s*(\\d+)");

        @Override
        public Dimension convert(String value) {
            Matcher m = SIZE.matcher(value.trim());
            if (!m.matches()) {
                throw new TypeConversionException("Invalid size '" + value + "': expected WIDTHxHEIGHT, e.g. 3000x3000");
            }
            try {
                return new Dimension(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
            } catch (NumberFormatException e) {
                throw new TypeConversionException("Size out of range: " + value);
            }
        }
    }

    /**
     * Parses {@code DX,DY}, each possibly negative, e.g. {@code 5,-3}.
     */
    static class OffsetConverter implements ITypeConverter<Point> {
        private static final Pattern OFFSET = Pattern.compile("(-?\\d+)\\s*,\\s*(-?\\d+)");

        @Override
        public Point convert(String value) {
            Matcher m = OFFSET.matcher(value.trim());
            if (!m.matches()) {
                throw new TypeConversionException("Invalid offset '" + value + "': expected DX,DY, e.g. 5,5");
            }
            try {
                return new Point(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
            } catch (NumberFormatException e) {
                throw new TypeConversionException("Offset out of range: " + value);
            }
        }
    }

    /**
     * Parses hex colours: {@code #RGB}, {@code #RRGGBB} or {@code #RRGGBBAA} (leading '#' optional).
     */
    static class ColorConverter implements ITypeConverter<Color> {
        private static final Pattern HEX = Pattern.compile("#?([0-9a-fA-F]{3}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");

        @Override
        public Color convert(String value) {
            Matcher m = HEX.matcher(value.trim());
            if (!m.matches()) {
                throw new TypeConversionException("Invalid color '" + value + "': expected #RGB, #RRGGBB or #RRGGBBAA");
            }
            String hex = m.group(1);
            if (hex.length() == 3) {
                hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1)
                        + hex.charAt(2) + hex.charAt(2);
            }
            int r = Integer.parseInt(hex.substring(0, 2), 16);
            int g = Integer.parseInt(hex.substring(2, 4), 16);
            int b = Integer.parseInt(hex.substring(4, 6), 16);
            int a = hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) : 255;
            return new Color(r, g, b, a);
        }
    }
}
