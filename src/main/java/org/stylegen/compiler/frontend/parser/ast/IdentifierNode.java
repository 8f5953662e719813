package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * A bare identifier: a reference to a declared value or to a palette color.
 */
public record IdentifierNode(String name, SourceLocation location) implements ExpressionNode {
}
