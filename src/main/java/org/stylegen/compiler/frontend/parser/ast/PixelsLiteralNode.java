package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * A pixel literal, e.g. {@code 30px}.
 */
public record PixelsLiteralNode(int value, SourceLocation location) implements ExpressionNode {
}
