package org.stylegen.compiler.icons;

/**
 * One file of a resolved icon layer.
 *
 * @param scale The pixel density factor: 1 for the base file, 2 or 3 for {@code @2x}/{@code @3x}.
 * @param file  The file path relative to the assets root.
 */
public record DensityVariant(int scale, String file) {
}
