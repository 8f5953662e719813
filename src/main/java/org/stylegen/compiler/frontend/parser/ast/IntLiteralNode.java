package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * An integer literal, e.g. {@code 42}.
 */
public record IntLiteralNode(int value, SourceLocation location) implements ExpressionNode {
}
