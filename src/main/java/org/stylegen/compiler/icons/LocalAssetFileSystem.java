package org.stylegen.compiler.icons;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * An {@link AssetFileSystem} rooted at a local directory.
 */
public class LocalAssetFileSystem implements AssetFileSystem {

    private final Path root;

    public LocalAssetFileSystem(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(String relativePath) {
        Path candidate = root.resolve(relativePath).normalize();
        // Icon paths must not escape the assets root.
        return candidate.startsWith(root) && Files.isRegularFile(candidate);
    }
}
