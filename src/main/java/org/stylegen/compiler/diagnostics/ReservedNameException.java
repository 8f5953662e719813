package org.stylegen.compiler.diagnostics;

/**
 * Thrown when a type or value is declared under the name of a built-in kind.
 */
public class ReservedNameException extends StyleCompilationException {

    public ReservedNameException(SourceLocation location, String message) {
        super(CompilerErrorCode.RESERVED_NAME, location, message);
    }
}
