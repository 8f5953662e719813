package org.stylegen.compiler.frontend.resolve.evaluation;

import org.stylegen.compiler.frontend.parser.features.align.AlignNode;
import org.stylegen.compiler.frontend.resolve.EvaluationContext;
import org.stylegen.compiler.frontend.resolve.IExpressionEvaluator;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.TypeRules;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.Optional;

public class AlignEvaluator implements IExpressionEvaluator<AlignNode> {

    @Override
    public ResolvedExpression evaluate(AlignNode node, String field, Optional<TypeRef> expected,
                                       EvaluationContext context) {
        return TypeRules.check(new ResolvedExpression.AlignValue(node.align()), expected, field,
                node.location(), context.symbols());
    }
}
