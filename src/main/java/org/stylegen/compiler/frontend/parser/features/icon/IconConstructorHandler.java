package org.stylegen.compiler.frontend.parser.features.icon;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.frontend.parser.IConstructorHandler;
import org.stylegen.compiler.frontend.parser.ParsingContext;
import org.stylegen.compiler.frontend.parser.ast.ColorLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.parser.ast.IdentifierNode;
import org.stylegen.compiler.icons.IconPath;
import org.stylegen.compiler.icons.IconPathParser;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the {@code icon} constructor.
 *
 * <p>Syntax: {@code icon{ {"path", color} [, {"path", color}]* [,] }}
 *
 * <p>Path modifiers ({@code _flip_horizontal}, {@code -24x24}, ...) are split off here via
 * {@link IconPathParser}; probing the asset files is left to the resolution engine.
 */
public class IconConstructorHandler implements IConstructorHandler {

    @Override
    public ExpressionNode parse(ParsingContext context, Token name) {
        context.consume(TokenType.LEFT_BRACE, "'{' after icon");
        List<IconEntryNode> layers = new ArrayList<>();
        do {
            if (context.check(TokenType.RIGHT_BRACE) && !layers.isEmpty()) {
                break; // trailing comma
            }
            layers.add(parseEntry(context));
        } while (context.match(TokenType.COMMA));
        context.consume(TokenType.RIGHT_BRACE, "'}' closing icon{...}");
        return new IconNode(layers, name.location());
    }

    private IconEntryNode parseEntry(ParsingContext context) {
        context.consume(TokenType.LEFT_BRACE, "'{' opening an icon layer");
        Token pathToken = context.consume(TokenType.STRING, "an icon path string");
        IconPath path = IconPathParser.parse((String) pathToken.value(), pathToken.location());
        context.consume(TokenType.COMMA, "',' after the icon path");

        Token colorToken = context.advance();
        ExpressionNode color = switch (colorToken.type()) {
            case IDENTIFIER -> new IdentifierNode(colorToken.text(), colorToken.location());
            case HEX_COLOR -> new ColorLiteralNode((String) colorToken.value(), colorToken.location());
            default -> throw new ParseException(colorToken.location(), "a color name or hex color", colorToken.describe());
        };
        context.consume(TokenType.RIGHT_BRACE, "'}' closing an icon layer");
        return new IconEntryNode(path, color, pathToken.location());
    }
}
