package org.stylegen.compiler.diagnostics;

/**
 * Thrown when a color name is neither a visible value nor defined by the color source.
 */
public class UndefinedColorException extends StyleCompilationException {

    public UndefinedColorException(SourceLocation location, String message) {
        super(CompilerErrorCode.UNDEFINED_COLOR, location, message);
    }
}
