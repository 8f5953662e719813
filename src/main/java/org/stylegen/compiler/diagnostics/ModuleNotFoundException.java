package org.stylegen.compiler.diagnostics;

/**
 * Thrown when a style module named by a {@code using} statement (or the root file) cannot be loaded.
 */
public class ModuleNotFoundException extends StyleCompilationException {

    public ModuleNotFoundException(SourceLocation location, String path, Throwable cause) {
        super(CompilerErrorCode.MODULE_NOT_FOUND, location, "Could not load style module: " + path, cause);
    }
}
