package org.stylegen.compiler.diagnostics;

/**
 * A position inside a style source file.
 *
 * @param file   The normalized path of the source file.
 * @param line   The 1-based line, or 0 when the position is not known.
 * @param column The 1-based column, or 0 when the position is not known.
 */
public record SourceLocation(String file, int line, int column) {

    /**
     * Creates a location that only names a file.
     *
     * @param file The normalized path of the source file.
     * @return A location with line and column set to 0.
     */
    public static SourceLocation ofFile(String file) {
        return new SourceLocation(file, 0, 0);
    }

    @Override
    public String toString() {
        if (line <= 0) {
            return file;
        }
        return file + ":" + line + ":" + column;
    }
}
