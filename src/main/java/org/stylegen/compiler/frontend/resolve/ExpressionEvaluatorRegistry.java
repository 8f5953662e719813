package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.frontend.parser.ast.BoolLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.ColorLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.DoubleLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.parser.ast.IdentifierNode;
import org.stylegen.compiler.frontend.parser.ast.IntLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.PixelsLiteralNode;
import org.stylegen.compiler.frontend.parser.features.align.AlignNode;
import org.stylegen.compiler.frontend.parser.features.font.FontNode;
import org.stylegen.compiler.frontend.parser.features.geometry.GeometryNode;
import org.stylegen.compiler.frontend.parser.features.icon.IconNode;
import org.stylegen.compiler.frontend.resolve.evaluation.AlignEvaluator;
import org.stylegen.compiler.frontend.resolve.evaluation.FontEvaluator;
import org.stylegen.compiler.frontend.resolve.evaluation.GeometryEvaluator;
import org.stylegen.compiler.frontend.resolve.evaluation.IconEvaluator;
import org.stylegen.compiler.frontend.resolve.evaluation.IdentifierEvaluator;
import org.stylegen.compiler.frontend.resolve.evaluation.LiteralEvaluators;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping expression node classes to their evaluators.
 */
public final class ExpressionEvaluatorRegistry {

    private final Map<Class<? extends ExpressionNode>, IExpressionEvaluator<?>> evaluators = new HashMap<>();

    /**
     * Registers an evaluator for the given node class.
     *
     * @param nodeType  The concrete node class.
     * @param evaluator The evaluator instance.
     * @param <T>       Concrete node type parameter.
     */
    public <T extends ExpressionNode> void register(Class<T> nodeType, IExpressionEvaluator<T> evaluator) {
        evaluators.put(nodeType, evaluator);
    }

    /**
     * Resolves the evaluator for a node.
     *
     * @param node The node to evaluate.
     * @param <T>  Concrete node type parameter.
     * @return Optional evaluator if registered.
     */
    @SuppressWarnings("unchecked")
    public <T extends ExpressionNode> Optional<IExpressionEvaluator<T>> resolve(T node) {
        return Optional.ofNullable((IExpressionEvaluator<T>) evaluators.get(node.getClass()));
    }

    /**
     * Creates a registry with an evaluator for every expression node the parser produces.
     *
     * @return A fully initialized registry.
     */
    public static ExpressionEvaluatorRegistry initializeWithDefaults() {
        ExpressionEvaluatorRegistry registry = new ExpressionEvaluatorRegistry();

        // Literals
        registry.register(IntLiteralNode.class, LiteralEvaluators.INT);
        registry.register(PixelsLiteralNode.class, LiteralEvaluators.PIXELS);
        registry.register(DoubleLiteralNode.class, LiteralEvaluators.DOUBLE);
        registry.register(BoolLiteralNode.class, LiteralEvaluators.BOOL);
        registry.register(ColorLiteralNode.class, LiteralEvaluators.COLOR);

        // References and constructors
        registry.register(IdentifierNode.class, new IdentifierEvaluator());
        registry.register(GeometryNode.class, new GeometryEvaluator());
        registry.register(AlignNode.class, new AlignEvaluator());
        registry.register(FontNode.class, new FontEvaluator());
        registry.register(IconNode.class, new IconEvaluator());

        return registry;
    }
}
