package org.stylegen.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file loading for the compiler: reads style sources from the local filesystem
 * and derives the logical names used for module identity and diagnostics.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The canonical name used for deduplication and diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path of the file; it is normalized before use.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        Path resolvedPath = normalize(path);
        String content = Files.readString(resolvedPath, StandardCharsets.UTF_8);
        return new LoadResult(normalizeLineEndings(content), logicalName(resolvedPath));
    }

    /**
     * Resolves a path written in a {@code using} statement against the directory of the
     * importing file.
     *
     * @param importingFile The logical name of the file containing the statement.
     * @param importPath    The path as written.
     * @return The normalized absolute path of the imported file.
     */
    public static Path resolveRelative(String importingFile, String importPath) {
        Path parent = Path.of(importingFile).getParent();
        Path base = parent != null ? parent : Path.of(".");
        return normalize(base.resolve(importPath));
    }

    /**
     * @param path Any path.
     * @return The absolute, normalized form of the path.
     */
    public static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * @param path A normalized path.
     * @return The path with forward slashes, used as module identity.
     */
    public static String logicalName(Path path) {
        return path.toString().replace('\\', '/');
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
