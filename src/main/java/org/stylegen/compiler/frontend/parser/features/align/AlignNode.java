package org.stylegen.compiler.frontend.parser.features.align;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.model.Align;

/**
 * An {@code align(keyword)} call.
 */
public record AlignNode(Align align, SourceLocation location) implements ExpressionNode {
}
