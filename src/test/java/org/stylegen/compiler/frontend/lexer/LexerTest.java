package org.stylegen.compiler.frontend.lexer;

import org.stylegen.compiler.diagnostics.CompilerErrorCode;
import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests tokenization of style sources.
 */
public class LexerTest {

    private static List<Token> scan(String source) {
        return new Lexer(source, "test.style").scanTokens();
    }

    private static List<TokenType> types(String source) {
        return scan(source).stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void scansTypeDeclaration() {
        assertThat(types("Btn { height: pixels; }")).containsExactly(
                TokenType.IDENTIFIER, TokenType.LEFT_BRACE, TokenType.IDENTIFIER, TokenType.COLON,
                TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.RIGHT_BRACE, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void distinguishesNumericLiterals() {
        List<Token> tokens = scan("12 30px -4px 1.5");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.INTEGER);
        assertThat(tokens.get(0).value()).isEqualTo(12);
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.PIXELS);
        assertThat(tokens.get(1).value()).isEqualTo(30);
        assertThat(tokens.get(2).type()).isEqualTo(TokenType.PIXELS);
        assertThat(tokens.get(2).value()).isEqualTo(-4);
        assertThat(tokens.get(3).type()).isEqualTo(TokenType.DOUBLE);
        assertThat(tokens.get(3).value()).isEqualTo(1.5);
    }

    @Test
    @Tag("unit")
    void pxFollowedByIdentifierCharactersIsNotAPixelSuffix() {
        assertThat(types("3pxa")).containsExactly(TokenType.INTEGER, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void scansKeywordsStringsAndColors() {
        List<Token> tokens = scan("using \"lib/base.style\" true false #FFaa00");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.USING);
        assertThat(tokens.get(1).value()).isEqualTo("lib/base.style");
        assertThat(tokens.get(2).value()).isEqualTo(Boolean.TRUE);
        assertThat(tokens.get(3).value()).isEqualTo(Boolean.FALSE);
        assertThat(tokens.get(4).type()).isEqualTo(TokenType.HEX_COLOR);
        assertThat(tokens.get(4).value()).isEqualTo("ffaa00");
    }

    @Test
    @Tag("unit")
    void tracksLinesAndColumnsAndSkipsComments() {
        List<Token> tokens = scan("// header\nfoo: 1;\n  bar: 2;");

        Token bar = tokens.get(4);
        assertThat(bar.text()).isEqualTo("bar");
        assertThat(bar.line()).isEqualTo(3);
        assertThat(bar.column()).isEqualTo(3);
        assertThat(bar.location().toString()).isEqualTo("test.style:3:3");
    }

    @Test
    @Tag("unit")
    void rejectsHexColorWithWrongDigitCount() {
        assertThatThrownBy(() -> scan("c: #12345;"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).code()).isEqualTo(CompilerErrorCode.PARSE_ERROR));
    }

    @Test
    @Tag("unit")
    void rejectsUnterminatedString() {
        assertThatThrownBy(() -> scan("f: font(12px, \"Inter"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    @Tag("unit")
    void escapedLineBreakDoesNotContinueString() {
        assertThatThrownBy(() -> scan("f: font(12px, \"Inter\\\nBold\");\ng: 1px;"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated")
                .satisfies(e -> {
                    assertThat(((ParseException) e).location().line()).isEqualTo(1);
                    assertThat(((ParseException) e).location().column()).isEqualTo(15);
                });
    }

    @Test
    @Tag("unit")
    void rejectsUnexpectedCharacter() {
        assertThatThrownBy(() -> scan("a: 1 + 2;"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("'+'");
    }
}
