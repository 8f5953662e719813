package org.stylegen.compiler.frontend.parser.features.icon;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.parser.ast.AstNode;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.icons.IconPath;

/**
 * One {@code { "path", color }} layer of an icon.
 *
 * @param path     The path with its modifiers already split off.
 * @param color    The layer color: an identifier or a hex color literal.
 * @param location The position of the path string.
 */
public record IconEntryNode(IconPath path, ExpressionNode color, SourceLocation location) implements AstNode {
}
