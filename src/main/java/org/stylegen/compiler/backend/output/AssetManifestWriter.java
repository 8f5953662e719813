package org.stylegen.compiler.backend.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.ResolvedSimple;
import org.stylegen.compiler.frontend.resolve.ResolvedStructure;
import org.stylegen.compiler.frontend.resolve.ResolvedUnit;
import org.stylegen.compiler.frontend.resolve.ResolvedValue;
import org.stylegen.compiler.icons.DensityVariant;
import org.stylegen.compiler.icons.IconAsset;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds {@code icons.manifest.json}: every icon asset file the compiled styles use, sorted,
 * so the packaging step knows which images to bundle. The file is written together with the
 * headers by {@link OutputWriter}.
 */
public class AssetManifestWriter {

    public static final String FILE_NAME = "icons.manifest.json";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * JSON shape of the manifest.
     */
    static final class Manifest {
        final String root;
        final List<String> assets;

        Manifest(String root, List<String> assets) {
            this.root = root;
            this.assets = assets;
        }
    }

    /**
     * @param unit The resolved unit.
     * @return The asset files referenced by any icon of the unit, relative to the assets root, sorted.
     */
    public SortedSet<String> collectAssets(ResolvedUnit unit) {
        SortedSet<String> files = new TreeSet<>();
        for (ResolvedValue value : unit.values().values()) {
            if (value instanceof ResolvedStructure structure) {
                structure.fields().values().forEach(expression -> collect(expression, files));
            } else if (value instanceof ResolvedSimple simple) {
                collect(simple.expression(), files);
            }
        }
        return files;
    }

    private static void collect(ResolvedExpression expression, SortedSet<String> files) {
        if (expression instanceof ResolvedExpression.IconValue icon) {
            for (IconAsset layer : icon.icon().layers()) {
                for (DensityVariant variant : layer.variants()) {
                    files.add(variant.file());
                }
            }
        }
    }

    /**
     * @param unit       The resolved unit.
     * @param assetsRoot The assets directory the paths are relative to.
     * @return The manifest JSON.
     */
    public String toJson(ResolvedUnit unit, String assetsRoot) {
        return gson.toJson(new Manifest(assetsRoot, new ArrayList<>(collectAssets(unit)))) + "\n";
    }
}
