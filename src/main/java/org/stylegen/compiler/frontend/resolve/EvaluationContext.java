package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.color.ColorSource;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.SymbolTable;
import org.stylegen.compiler.frontend.semantics.TypeRef;
import org.stylegen.compiler.icons.IconAssetResolver;

import java.util.Optional;

/**
 * What an {@link IExpressionEvaluator} can reach while evaluating one expression of one value.
 */
public interface EvaluationContext {

    /**
     * @return The module the expression is written in; lookups are restricted to what it can see.
     */
    ModuleId module();

    SymbolTable symbols();

    ColorSource colors();

    IconAssetResolver icons();

    /**
     * Resolves a referenced value, recursively if it has not been resolved yet.
     *
     * @param symbol   The visible value symbol name.
     * @param location Where the reference is written.
     * @return The resolved value.
     * @throws org.stylegen.compiler.diagnostics.CyclicReferenceException if the value is still being resolved.
     */
    ResolvedValue resolveReference(String symbol, SourceLocation location);

    /**
     * Evaluates a nested expression, e.g. a constructor argument.
     *
     * @param node     The expression.
     * @param field    The field or argument name used in error messages.
     * @param expected The expected type, empty to infer it.
     * @return The checked expression.
     */
    ResolvedExpression evaluate(ExpressionNode node, String field, Optional<TypeRef> expected);
}
