package org.stylegen.compiler.diagnostics;

/**
 * Thrown when an icon path modifier does not fit the resolved asset format:\n * forced sizes need a vector asset, flips need a raster asset.
 */
public class ModifierIncompatibleException extends StyleCompilationException {

    public ModifierIncompatibleException(SourceLocation location, String message) {
        super(CompilerErrorCode.MODIFIER_INCOMPATIBLE, location, message);
    }
}
