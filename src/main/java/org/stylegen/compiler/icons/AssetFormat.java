package org.stylegen.compiler.icons;

/**
 * The kind of image file an icon layer was resolved to.
 */
public enum AssetFormat {
    /** A single {@code .svg} file that scales to any size. */
    VECTOR,
    /** A {@code .png} file, optionally with {@code @2x} and {@code @3x} density variants. */
    RASTER
}
