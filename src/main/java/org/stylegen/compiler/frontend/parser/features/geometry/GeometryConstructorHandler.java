package org.stylegen.compiler.frontend.parser.features.geometry;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.frontend.parser.IConstructorHandler;
import org.stylegen.compiler.frontend.parser.ParsingContext;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the fixed-arity geometry constructors.
 *
 * <p>Syntax: {@code margins(e, e, e, e)}, {@code size(e, e)}, {@code point(e, e)}
 */
public class GeometryConstructorHandler implements IConstructorHandler {

    private final BuiltinKind kind;
    private final int arity;

    public GeometryConstructorHandler(BuiltinKind kind, int arity) {
        this.kind = kind;
        this.arity = arity;
    }

    @Override
    public ExpressionNode parse(ParsingContext context, Token name) {
        context.consume(TokenType.LEFT_PAREN, "'(' after " + name.text());
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(context.parseExpression());
            } while (context.match(TokenType.COMMA));
        }
        Token close = context.consume(TokenType.RIGHT_PAREN, "')' closing " + name.text() + "(...)");
        if (arguments.size() != arity) {
            throw new ParseException(close.location(),
                    name.text() + "(...) takes " + arity + " arguments, but got " + arguments.size());
        }
        return new GeometryNode(kind, arguments, name.location());
    }
}
