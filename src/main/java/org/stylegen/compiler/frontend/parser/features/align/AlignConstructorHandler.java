package org.stylegen.compiler.frontend.parser.features.align;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.frontend.parser.IConstructorHandler;
import org.stylegen.compiler.frontend.parser.ParsingContext;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.model.Align;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Parses {@code align(left)}, {@code align(topright)}, ...
 */
public class AlignConstructorHandler implements IConstructorHandler {

    private static final String KEYWORDS = Arrays.stream(Align.values())
            .map(Align::keyword)
            .collect(Collectors.joining(", "));

    @Override
    public ExpressionNode parse(ParsingContext context, Token name) {
        context.consume(TokenType.LEFT_PAREN, "'(' after align");
        Token keyword = context.consume(TokenType.IDENTIFIER, "an alignment (" + KEYWORDS + ")");
        Align align = Align.fromKeyword(keyword.text())
                .orElseThrow(() -> new ParseException(keyword.location(),
                        "an alignment (" + KEYWORDS + ")", keyword.describe()));
        context.consume(TokenType.RIGHT_PAREN, "')' closing align(...)");
        return new AlignNode(align, name.location());
    }
}
