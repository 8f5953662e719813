package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * A hex color literal; {@code hexDigits} holds the 3, 6 or 8 lower-case digits without {@code #}.
 */
public record ColorLiteralNode(String hexDigits, SourceLocation location) implements ExpressionNode {
}
