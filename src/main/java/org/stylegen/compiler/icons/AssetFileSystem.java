package org.stylegen.compiler.icons;

/**
 * Read-only existence probes against the icon assets directory.
 */
public interface AssetFileSystem {

    /**
     * @param relativePath A path relative to the assets root, with forward slashes.
     * @return True if a regular file exists at that path.
     */
    boolean exists(String relativePath);
}
