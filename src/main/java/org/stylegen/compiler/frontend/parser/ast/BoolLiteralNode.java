package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * {@code true} or {@code false}.
 */
public record BoolLiteralNode(boolean value, SourceLocation location) implements ExpressionNode {
}
