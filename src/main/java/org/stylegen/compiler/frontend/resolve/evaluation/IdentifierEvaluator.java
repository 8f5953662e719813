package org.stylegen.compiler.frontend.resolve.evaluation;

import org.stylegen.compiler.color.ColorValue;
import org.stylegen.compiler.diagnostics.UndefinedColorException;
import org.stylegen.compiler.diagnostics.UndefinedNameException;
import org.stylegen.compiler.frontend.parser.ast.IdentifierNode;
import org.stylegen.compiler.frontend.resolve.EvaluationContext;
import org.stylegen.compiler.frontend.resolve.IExpressionEvaluator;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.ResolvedValue;
import org.stylegen.compiler.frontend.resolve.TypeRules;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.frontend.semantics.TypeRef;
import org.stylegen.compiler.frontend.semantics.ValueSymbol;

import java.util.Optional;

/**
 * Evaluates a bare identifier. A value visible from the current module wins; otherwise,
 * where a color is expected or the type is inferred, the name is looked up in the palette.
 */
public class IdentifierEvaluator implements IExpressionEvaluator<IdentifierNode> {

    private static final TypeRef COLOR = TypeRef.of(BuiltinKind.COLOR);

    @Override
    public ResolvedExpression evaluate(IdentifierNode node, String field, Optional<TypeRef> expected,
                                       EvaluationContext context) {
        String name = node.name();
        Optional<ValueSymbol> visible = context.symbols().findVisibleValue(name, context.module());
        if (visible.isPresent()) {
            ResolvedValue target = context.resolveReference(name, node.location());
            return TypeRules.check(new ResolvedExpression.ValueReference(name, target), expected, field,
                    node.location(), context.symbols());
        }

        boolean colorPosition = expected.isEmpty() || expected.get().sameAs(COLOR);
        if (colorPosition) {
            Optional<ColorValue> color = context.colors().resolveColor(name);
            if (color.isPresent()) {
                return new ResolvedExpression.ColorConstant(color.get(), Optional.of(name));
            }
        }

        if (context.symbols().findValue(name).isPresent()) {
            // Exists, but in a module that is not imported; report that rather than a missing color.
            context.symbols().lookupValue(name, context.module(), node.location());
        }
        if (expected.isPresent() && colorPosition) {
            throw new UndefinedColorException(node.location(), "Undefined color '" + name + "'");
        }
        throw new UndefinedNameException(node.location(), name);
    }
}
