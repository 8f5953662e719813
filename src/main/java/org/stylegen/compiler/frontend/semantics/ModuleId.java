package org.stylegen.compiler.frontend.semantics;

/**
 * Identifies a style module by its resolved, normalized file path.
 * Two {@code using} statements reaching the same file yield equal ids.
 *
 * @param path The normalized absolute path, with forward slashes.
 */
public record ModuleId(String path) implements Comparable<ModuleId> {

    /**
     * @return The file name without directory and without the last extension,
     *         e.g. {@code basic} for {@code /ui/basic.style}.
     */
    public String stem() {
        int slash = path.lastIndexOf('/');
        String fileName = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    @Override
    public int compareTo(ModuleId other) {
        return path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return path;
    }
}
