package org.stylegen.compiler.icons;

/**
 * Render size requested by a trailing {@code -WxH} path suffix.
 *
 * @param width  Width in pixels, positive.
 * @param height Height in pixels, positive.
 */
public record ForcedSize(int width, int height) {

    public ForcedSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Forced icon size must be positive: " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
