package org.stylegen.compiler.icons;

import java.util.List;

/**
 * The resolved layers of an icon in painting order: the first layer is painted first and
 * every later layer on top of it.
 */
public record ResolvedIcon(List<IconAsset> layers) {

    public ResolvedIcon {
        layers = List.copyOf(layers);
    }
}
