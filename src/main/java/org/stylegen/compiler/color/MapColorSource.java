package org.stylegen.compiler.color;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An in-memory color table.
 */
public class MapColorSource implements ColorSource {

    private final Map<String, ColorValue> colors;

    public MapColorSource(Map<String, ColorValue> colors) {
        this.colors = Map.copyOf(colors);
    }

    /**
     * Builds a table from {@code name -> hex} pairs.
     *
     * @param hexColors Hex colors by name, see {@link ColorValue#parseHex(String)}.
     * @return The color source.
     */
    public static MapColorSource ofHex(Map<String, String> hexColors) {
        Map<String, ColorValue> parsed = new LinkedHashMap<>();
        hexColors.forEach((name, hex) -> parsed.put(name, ColorValue.parseHex(hex)));
        return new MapColorSource(parsed);
    }

    @Override
    public Optional<ColorValue> resolveColor(String name) {
        return Optional.ofNullable(colors.get(name));
    }
}
