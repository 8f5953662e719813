package org.stylegen.compiler.icons;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;

/**
 * One layer to resolve: a parsed path and its already evaluated color.
 *
 * @param path     The path with modifiers.
 * @param color    The layer color (a color literal, palette color or reference to a color value).
 * @param location The position of the path string, used for errors.
 */
public record IconLayerRequest(IconPath path, ResolvedExpression color, SourceLocation location) {
}
