package org.stylegen.compiler.frontend.resolve.evaluation;

import org.stylegen.compiler.frontend.parser.features.icon.IconEntryNode;
import org.stylegen.compiler.frontend.parser.features.icon.IconNode;
import org.stylegen.compiler.frontend.resolve.EvaluationContext;
import org.stylegen.compiler.frontend.resolve.IExpressionEvaluator;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.TypeRules;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.frontend.semantics.TypeRef;
import org.stylegen.compiler.icons.IconLayerRequest;
import org.stylegen.compiler.icons.ResolvedIcon;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates {@code icon{...}}: layer colors first, in order, then the asset lookup for all layers.
 */
public class IconEvaluator implements IExpressionEvaluator<IconNode> {

    private static final Optional<TypeRef> COLOR = Optional.of(TypeRef.of(BuiltinKind.COLOR));

    @Override
    public ResolvedExpression evaluate(IconNode node, String field, Optional<TypeRef> expected,
                                       EvaluationContext context) {
        List<IconLayerRequest> requests = new ArrayList<>();
        for (IconEntryNode layer : node.layers()) {
            ResolvedExpression color = context.evaluate(layer.color(), "icon.color", COLOR);
            requests.add(new IconLayerRequest(layer.path(), color, layer.location()));
        }
        ResolvedIcon icon = context.icons().resolve(requests);
        return TypeRules.check(new ResolvedExpression.IconValue(icon), expected, field, node.location(),
                context.symbols());
    }
}
