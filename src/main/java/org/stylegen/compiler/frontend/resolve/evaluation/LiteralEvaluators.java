package org.stylegen.compiler.frontend.resolve.evaluation;

import org.stylegen.compiler.color.ColorValue;
import org.stylegen.compiler.frontend.parser.ast.BoolLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.ColorLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.DoubleLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.IntLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.PixelsLiteralNode;
import org.stylegen.compiler.frontend.resolve.IExpressionEvaluator;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.TypeRules;

import java.util.Optional;

/**
 * Evaluators for the literal nodes.
 */
public final class LiteralEvaluators {

    public static final IExpressionEvaluator<IntLiteralNode> INT = (node, field, expected, context) ->
            TypeRules.check(new ResolvedExpression.IntValue(node.value()), expected, field, node.location(), context.symbols());

    public static final IExpressionEvaluator<PixelsLiteralNode> PIXELS = (node, field, expected, context) ->
            TypeRules.check(new ResolvedExpression.PixelsValue(node.value()), expected, field, node.location(), context.symbols());

    public static final IExpressionEvaluator<DoubleLiteralNode> DOUBLE = (node, field, expected, context) ->
            TypeRules.check(new ResolvedExpression.DoubleValue(node.value()), expected, field, node.location(), context.symbols());

    public static final IExpressionEvaluator<BoolLiteralNode> BOOL = (node, field, expected, context) ->
            TypeRules.check(new ResolvedExpression.BoolValue(node.value()), expected, field, node.location(), context.symbols());

    public static final IExpressionEvaluator<ColorLiteralNode> COLOR = (node, field, expected, context) ->
            TypeRules.check(new ResolvedExpression.ColorConstant(ColorValue.parseHex(node.hexDigits()), Optional.empty()),
                    expected, field, node.location(), context.symbols());

    private LiteralEvaluators() {
    }
}
