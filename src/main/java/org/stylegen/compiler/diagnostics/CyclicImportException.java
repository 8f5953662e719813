package org.stylegen.compiler.diagnostics;

/**
 * Thrown when the {@code using} graph of the compilation unit contains a cycle.
 */
public class CyclicImportException extends StyleCompilationException {

    public CyclicImportException(SourceLocation location, String message) {
        super(CompilerErrorCode.CYCLIC_IMPORT, location, message);
    }
}
