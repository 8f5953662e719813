package org.stylegen.compiler.frontend.parser;

import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.model.Token;

/**
 * Handler interface for the built-in constructor calls ({@code margins(...)}, {@code font(...)},
 * {@code icon{...}}, ...). The parser calls the handler after consuming the constructor name.
 */
public interface IConstructorHandler {

    /**
     * Parses the argument list of the constructor.
     *
     * @param context The parsing context, positioned right after the constructor name.
     * @param name    The already consumed constructor name token.
     * @return The expression node for the call.
     */
    ExpressionNode parse(ParsingContext context, Token name);
}
