package org.stylegen.compiler.frontend.parser.features.font;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.frontend.parser.IConstructorHandler;
import org.stylegen.compiler.frontend.parser.ParsingContext;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.model.FontFlag;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Parses the {@code font} constructor.
 *
 * <p>Syntax: {@code font(size [, flag]* [, "family"])} where flag is one of
 * {@code bold}, {@code semibold}, {@code italic}, {@code underline}, {@code monospace}.
 */
public class FontConstructorHandler implements IConstructorHandler {

    @Override
    public ExpressionNode parse(ParsingContext context, Token name) {
        context.consume(TokenType.LEFT_PAREN, "'(' after font");
        ExpressionNode size = context.parseExpression();

        EnumSet<FontFlag> flags = EnumSet.noneOf(FontFlag.class);
        String family = null;
        while (context.match(TokenType.COMMA)) {
            Token token = context.peek();
            if (token.type() == TokenType.STRING) {
                if (family != null) {
                    throw new ParseException(token.location(), "font(...) takes at most one family");
                }
                family = (String) context.advance().value();
            } else if (token.type() == TokenType.IDENTIFIER && FontFlag.fromKeyword(token.text()).isPresent()) {
                FontFlag flag = FontFlag.fromKeyword(context.advance().text()).orElseThrow();
                if (!flags.add(flag)) {
                    throw new ParseException(token.location(), "Font flag '" + flag.keyword() + "' given twice");
                }
            } else {
                throw new ParseException(token.location(), "a font flag or family string", token.describe());
            }
        }
        context.consume(TokenType.RIGHT_PAREN, "')' closing font(...)");
        return new FontNode(size, Collections.unmodifiableSet(flags), Optional.ofNullable(family), name.location());
    }
}
