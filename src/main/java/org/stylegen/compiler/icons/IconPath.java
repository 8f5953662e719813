package org.stylegen.compiler.icons;

import java.util.Optional;

/**
 * An icon path string split into its asset stem and the modifiers encoded in its suffixes.
 *
 * @param raw        The path exactly as written in the source.
 * @param stem       The path without modifier suffixes; asset files are probed from it.
 * @param flip       The flip modifier, if any.
 * @param forcedSize The forced size modifier, if any.
 */
public record IconPath(String raw, String stem, Optional<FlipAxis> flip, Optional<ForcedSize> forcedSize) {

    public boolean hasModifiers() {
        return flip.isPresent() || forcedSize.isPresent();
    }
}
