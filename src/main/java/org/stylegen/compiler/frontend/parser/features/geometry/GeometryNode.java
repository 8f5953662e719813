package org.stylegen.compiler.frontend.parser.features.geometry;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;

import java.util.List;

/**
 * A {@code margins(l, t, r, b)}, {@code size(w, h)} or {@code point(x, y)} call.
 *
 * @param kind      {@link BuiltinKind#MARGINS}, {@link BuiltinKind#SIZE} or {@link BuiltinKind#POINT}.
 * @param arguments The pixel arguments, arity already checked by the parser.
 * @param location  The position of the constructor name.
 */
public record GeometryNode(BuiltinKind kind, List<ExpressionNode> arguments, SourceLocation location)
        implements ExpressionNode {

    public GeometryNode {
        arguments = List.copyOf(arguments);
    }
}
