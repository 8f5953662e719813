package org.stylegen.compiler.frontend.resolve.evaluation;

import org.stylegen.compiler.frontend.parser.features.geometry.GeometryNode;
import org.stylegen.compiler.frontend.resolve.EvaluationContext;
import org.stylegen.compiler.frontend.resolve.IExpressionEvaluator;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.TypeRules;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates {@code margins}, {@code size} and {@code point}. Every argument must be {@code pixels}.
 */
public class GeometryEvaluator implements IExpressionEvaluator<GeometryNode> {

    private static final Optional<TypeRef> PIXELS = Optional.of(TypeRef.of(BuiltinKind.PIXELS));

    @Override
    public ResolvedExpression evaluate(GeometryNode node, String field, Optional<TypeRef> expected,
                                       EvaluationContext context) {
        List<String> names = argumentNames(node.kind());
        int[] values = new int[names.size()];
        for (int i = 0; i < values.length; i++) {
            String argument = node.kind().keyword() + "." + names.get(i);
            ResolvedExpression value = context.evaluate(node.arguments().get(i), argument, PIXELS);
            values[i] = TypeRules.pixelsOf(value);
        }

        ResolvedExpression result = switch (node.kind()) {
            case MARGINS -> new ResolvedExpression.MarginsValue(values[0], values[1], values[2], values[3]);
            case SIZE -> new ResolvedExpression.SizeValue(values[0], values[1]);
            case POINT -> new ResolvedExpression.PointValue(values[0], values[1]);
            default -> throw new IllegalStateException("Not a geometry constructor: " + node.kind());
        };
        return TypeRules.check(result, expected, field, node.location(), context.symbols());
    }

    private static List<String> argumentNames(BuiltinKind kind) {
        return switch (kind) {
            case MARGINS -> List.of("left", "top", "right", "bottom");
            case SIZE -> List.of("width", "height");
            case POINT -> List.of("x", "y");
            default -> throw new IllegalStateException("Not a geometry constructor: " + kind);
        };
    }
}
