package org.stylegen.compiler.model;

/**
 * The kinds of tokens produced by the style {@link org.stylegen.compiler.frontend.lexer.Lexer}.
 * Each kind carries the description used in "expected ..." parse errors.
 */
public enum TokenType {
    IDENTIFIER("an identifier"),
    STRING("a string"),
    INTEGER("an integer"),
    PIXELS("a pixel literal"),
    DOUBLE("a floating point number"),
    HEX_COLOR("a hex color"),

    USING("'using'"),
    TRUE("'true'"),
    FALSE("'false'"),

    LEFT_BRACE("'{'"),
    RIGHT_BRACE("'}'"),
    LEFT_PAREN("'('"),
    RIGHT_PAREN("')'"),
    COLON("':'"),
    SEMICOLON("';'"),
    COMMA("','"),

    END_OF_FILE("the end of the file");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
