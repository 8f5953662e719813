package org.stylegen.compiler.frontend.resolve.evaluation;

import org.stylegen.compiler.frontend.parser.features.font.FontNode;
import org.stylegen.compiler.frontend.resolve.EvaluationContext;
import org.stylegen.compiler.frontend.resolve.IExpressionEvaluator;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.TypeRules;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.Optional;

/**
 * Evaluates {@code font(size, flags..., "family")}; the size must be {@code pixels}.
 */
public class FontEvaluator implements IExpressionEvaluator<FontNode> {

    @Override
    public ResolvedExpression evaluate(FontNode node, String field, Optional<TypeRef> expected,
                                       EvaluationContext context) {
        ResolvedExpression size = context.evaluate(node.size(), "font.size",
                Optional.of(TypeRef.of(BuiltinKind.PIXELS)));
        ResolvedExpression font = new ResolvedExpression.FontValue(TypeRules.pixelsOf(size), node.flags(), node.family());
        return TypeRules.check(font, expected, field, node.location(), context.symbols());
    }
}
