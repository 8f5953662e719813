package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.Optional;

/**
 * Evaluates one kind of expression node.
 *
 * @param <T> The node type handled.
 */
public interface IExpressionEvaluator<T extends ExpressionNode> {

    /**
     * @param node     The expression to evaluate.
     * @param field    The field or argument being assigned, for error messages.
     * @param expected The type the field expects; empty when the field is new and its type is inferred.
     * @param context  Access to references, colors and icons.
     * @return The evaluated expression, already checked against {@code expected}.
     */
    ResolvedExpression evaluate(T node, String field, Optional<TypeRef> expected, EvaluationContext context);
}
