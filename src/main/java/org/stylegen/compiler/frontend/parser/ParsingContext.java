package org.stylegen.compiler.frontend.parser;

import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;

/**
 * Provides constructor handlers with access to the token stream.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 * <p>
 * Unlike a recovering parser, every mismatch is fatal: {@link #consume} throws a
 * {@link org.stylegen.compiler.diagnostics.ParseException}.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param expected Description of the expected syntax, used in the error message.
     * @return The consumed token.
     * @throws org.stylegen.compiler.diagnostics.ParseException if the type does not match.
     */
    Token consume(TokenType type, String expected);

    /**
     * Parses a complete expression starting at the current token.
     * @return The expression node.
     */
    ExpressionNode parseExpression();
}
