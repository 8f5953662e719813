package org.stylegen.compiler.icons;

import org.stylegen.compiler.diagnostics.AssetNotFoundException;
import org.stylegen.compiler.diagnostics.ModifierIncompatibleException;
import org.stylegen.compiler.util.Concurrency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves icon layers to asset files using the naming convention of the assets directory.
 *
 * <p>For a stem {@code icons/close} the resolver probes {@code icons/close.svg} first; a
 * vector file wins. Otherwise {@code icons/close.png} is required, and {@code icons/close@2x.png}
 * and {@code icons/close@3x.png} are picked up as density variants when present. Density
 * variants without the base {@code .png} do not count.</p>
 *
 * <p>A forced size only applies to vector assets, a flip only to raster assets. Layers are
 * probed in parallel but returned in request order.</p>
 */
public class IconAssetResolver {

    private static final Logger log = LoggerFactory.getLogger(IconAssetResolver.class);

    private final AssetFileSystem fileSystem;
    private final Executor executor;

    /**
     * @param fileSystem The assets directory.
     * @param executor   Executor the layers are probed on.
     */
    public IconAssetResolver(AssetFileSystem fileSystem, Executor executor) {
        this.fileSystem = fileSystem;
        this.executor = executor;
    }

    /**
     * Creates a resolver that probes on the calling thread.
     *
     * @param fileSystem The assets directory.
     */
    public IconAssetResolver(AssetFileSystem fileSystem) {
        this(fileSystem, Runnable::run);
    }

    /**
     * @param layers The layers in source order.
     * @return The resolved icon with layers in the same order.
     * @throws AssetNotFoundException         if a layer has neither a vector nor a raster file.
     * @throws ModifierIncompatibleException  if a modifier does not apply to the format found.
     */
    public ResolvedIcon resolve(List<IconLayerRequest> layers) {
        List<CompletableFuture<IconAsset>> futures = new ArrayList<>();
        for (IconLayerRequest layer : layers) {
            futures.add(CompletableFuture.supplyAsync(() -> resolveLayer(layer), executor));
        }
        List<IconAsset> assets = new ArrayList<>();
        for (CompletableFuture<IconAsset> future : futures) {
            assets.add(Concurrency.await(future));
        }
        return new ResolvedIcon(assets);
    }

    private IconAsset resolveLayer(IconLayerRequest layer) {
        IconPath path = layer.path();
        String stem = path.stem();

        String svg = stem + ".svg";
        if (fileSystem.exists(svg)) {
            if (path.flip().isPresent()) {
                throw new ModifierIncompatibleException(layer.location(),
                        "Icon '" + path.raw() + "' resolved to vector asset " + svg
                                + "; flip modifiers only apply to raster assets");
            }
            log.debug("Icon layer '{}' resolved to vector asset {}", path.raw(), svg);
            return new IconAsset(stem, AssetFormat.VECTOR, List.of(new DensityVariant(1, svg)),
                    path.forcedSize(), path.flip(), layer.color());
        }

        String png = stem + ".png";
        if (!fileSystem.exists(png)) {
            throw new AssetNotFoundException(layer.location(),
                    "No asset for icon '" + path.raw() + "'; probed " + svg + ", " + png);
        }
        if (path.forcedSize().isPresent()) {
            throw new ModifierIncompatibleException(layer.location(),
                    "Icon '" + path.raw() + "' resolved to raster asset " + png
                            + "; size modifiers only apply to vector assets");
        }

        List<DensityVariant> variants = new ArrayList<>();
        variants.add(new DensityVariant(1, png));
        for (int scale = 2; scale <= 3; scale++) {
            String variant = stem + "@" + scale + "x.png";
            if (fileSystem.exists(variant)) {
                variants.add(new DensityVariant(scale, variant));
            }
        }
        log.debug("Icon layer '{}' resolved to raster asset {} with {} density variant(s)",
                path.raw(), png, variants.size());
        return new IconAsset(stem, AssetFormat.RASTER, variants, path.forcedSize(), path.flip(), layer.color());
    }
}
