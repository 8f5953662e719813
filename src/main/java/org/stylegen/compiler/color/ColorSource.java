package org.stylegen.compiler.color;

import java.util.Optional;

/**
 * The central color table that identifiers in color positions are looked up in.
 * The resolution engine receives it explicitly, so tests can substitute their own table.
 */
public interface ColorSource {

    /**
     * @param name The palette name as written in the style source.
     * @return The color, or empty if the name is not defined.
     */
    Optional<ColorValue> resolveColor(String name);

    /**
     * @return A source that defines no colors.
     */
    static ColorSource empty() {
        return name -> Optional.empty();
    }
}
