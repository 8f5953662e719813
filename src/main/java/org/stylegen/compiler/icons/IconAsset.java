package org.stylegen.compiler.icons;

import org.stylegen.compiler.frontend.resolve.ResolvedExpression;

import java.util.List;
import java.util.Optional;

/**
 * A resolved icon layer.
 *
 * @param stem       The asset stem relative to the assets root.
 * @param format     Vector or raster.
 * @param variants   The files found, ascending by scale. A vector asset has exactly one.
 * @param forcedSize The render size, only ever present for vector assets.
 * @param flip       The flip axis, only ever present for raster assets.
 * @param color      The layer color.
 */
public record IconAsset(
        String stem,
        AssetFormat format,
        List<DensityVariant> variants,
        Optional<ForcedSize> forcedSize,
        Optional<FlipAxis> flip,
        ResolvedExpression color
) {

    public IconAsset {
        variants = List.copyOf(variants);
    }

    /**
     * @return The base file: the {@code .svg} or the 1x {@code .png}.
     */
    public String baseFile() {
        return variants.get(0).file();
    }
}
