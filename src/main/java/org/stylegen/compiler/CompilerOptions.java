package org.stylegen.compiler;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Inputs and outputs of a compiler run.
 *
 * @param assetsRoot      The directory icon paths are resolved against.
 * @param paletteFile     The palette file, if colors are looked up by name.
 * @param outputDirectory Where headers and the manifest are written.
 * @param writeManifest   Whether to write {@code icons.manifest.json}.
 * @param parallelism     Worker threads for parsing and icon probing.
 */
public record CompilerOptions(
        Path assetsRoot,
        Optional<Path> paletteFile,
        Path outputDirectory,
        boolean writeManifest,
        int parallelism
) {

    public CompilerOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    /**
     * Reads the options from the {@code stylegen} config block. An empty {@code palette.file}
     * means no palette, a {@code compiler.parallelism} of 0 means one thread per processor.
     *
     * @param config The {@code stylegen} block.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        String palette = config.getString("palette.file");
        int parallelism = config.getInt("compiler.parallelism");
        return new CompilerOptions(
                Path.of(config.getString("assets.root")),
                palette.isBlank() ? Optional.empty() : Optional.of(Path.of(palette)),
                Path.of(config.getString("output.directory")),
                config.getBoolean("output.manifest"),
                parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors());
    }

    public CompilerOptions withAssetsRoot(Path assetsRoot) {
        return new CompilerOptions(assetsRoot, paletteFile, outputDirectory, writeManifest, parallelism);
    }

    public CompilerOptions withPaletteFile(Path paletteFile) {
        return new CompilerOptions(assetsRoot, Optional.of(paletteFile), outputDirectory, writeManifest, parallelism);
    }

    public CompilerOptions withOutputDirectory(Path outputDirectory) {
        return new CompilerOptions(assetsRoot, paletteFile, outputDirectory, writeManifest, parallelism);
    }

    public CompilerOptions withWriteManifest(boolean writeManifest) {
        return new CompilerOptions(assetsRoot, paletteFile, outputDirectory, writeManifest, parallelism);
    }
}
