package org.stylegen.compiler.color;

import java.util.Locale;

/**
 * A concrete RGBA color, each channel in {@code 0..255}.
 */
public record ColorValue(int red, int green, int blue, int alpha) {

    public ColorValue {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
        checkChannel("alpha", alpha);
    }

    /**
     * Parses {@code rgb}, {@code rrggbb} or {@code rrggbbaa} hex digits, with or without a leading {@code #}.
     * Three-digit colors expand each digit ({@code f80} is {@code ff8800}); alpha defaults to {@code ff}.
     *
     * @param hex The hex digits.
     * @return The color.
     * @throws IllegalArgumentException if the text is not a valid hex color.
     */
    public static ColorValue parseHex(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (!digits.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("Invalid hex color: " + hex);
        }
        return switch (digits.length()) {
            case 3 -> new ColorValue(
                    Character.digit(digits.charAt(0), 16) * 17,
                    Character.digit(digits.charAt(1), 16) * 17,
                    Character.digit(digits.charAt(2), 16) * 17,
                    255);
            case 6 -> new ColorValue(channel(digits, 0), channel(digits, 2), channel(digits, 4), 255);
            case 8 -> new ColorValue(channel(digits, 0), channel(digits, 2), channel(digits, 4), channel(digits, 6));
            default -> throw new IllegalArgumentException("Invalid hex color: " + hex);
        };
    }

    /**
     * @return The color as {@code #rrggbbaa} in lower case.
     */
    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x%02x", red, green, blue, alpha);
    }

    private static int channel(String digits, int offset) {
        return Integer.parseInt(digits.substring(offset, offset + 2), 16);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range: " + value);
        }
    }
}
