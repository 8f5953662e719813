package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * A floating point literal, e.g. {@code 1.5}.
 */
public record DoubleLiteralNode(double value, SourceLocation location) implements ExpressionNode {
}
