package org.stylegen.compiler.frontend.parser.ast;

/**
 * Marker for nodes that can appear on the right-hand side of a field assignment or as a
 * simple value. Each concrete expression node has an evaluator registered in
 * {@link org.stylegen.compiler.frontend.resolve.ExpressionEvaluatorRegistry}.
 */
public interface ExpressionNode extends AstNode {
}
