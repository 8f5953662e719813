package org.stylegen.compiler.diagnostics;

/**
 * Thrown when no vector or raster file exists for an icon path.
 */
public class AssetNotFoundException extends StyleCompilationException {

    public AssetNotFoundException(SourceLocation location, String message) {
        super(CompilerErrorCode.ASSET_NOT_FOUND, location, message);
    }
}
