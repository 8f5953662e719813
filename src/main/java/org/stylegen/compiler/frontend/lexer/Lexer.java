package org.stylegen.compiler.frontend.lexer;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the text of one style source file into a list of {@link Token}s.
 * <p>
 * Whitespace and {@code //} line comments are dropped. Number literals may carry a leading
 * {@code -}; an integer directly followed by {@code px} becomes a {@link TokenType#PIXELS} token.
 * The returned list always ends with an {@link TokenType#END_OF_FILE} token.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "using", TokenType.USING,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE);

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * @param source   The complete file content.
     * @param fileName The normalized path used in token locations.
     */
    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Scans the whole source.
     *
     * @return The tokens, terminated by {@link TokenType#END_OF_FILE}.
     * @throws ParseException on characters that start no token or on unterminated strings.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, fileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{' -> addToken(TokenType.LEFT_BRACE, null);
            case '}' -> addToken(TokenType.RIGHT_BRACE, null);
            case '(' -> addToken(TokenType.LEFT_PAREN, null);
            case ')' -> addToken(TokenType.RIGHT_PAREN, null);
            case ':' -> addToken(TokenType.COLON, null);
            case ';' -> addToken(TokenType.SEMICOLON, null);
            case ',' -> addToken(TokenType.COMMA, null);
            case ' ', '\t', '\r' -> { }
            case '\n' -> newLine();
            case '/' -> {
                if (peek() == '/') {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    throw unexpected(c);
                }
            }
            case '"' -> string();
            case '#' -> hexColor();
            case '-' -> {
                if (isDigit(peek())) {
                    number();
                } else {
                    throw unexpected(c);
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw unexpected(c);
                }
            }
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"') {
            if (isAtEnd() || peek() == '\n') {
                throw new ParseException(startLocation(), "Unterminated string literal");
            }
            char c = advance();
            if (c == '\\' && (peek() == '\n' || peek() == '\r')) {
                throw new ParseException(startLocation(), "Unterminated string literal");
            }
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        advance(); // closing quote
        addToken(TokenType.STRING, value.toString());
    }

    private void hexColor() {
        while (isHexDigit(peek())) advance();
        String digits = source.substring(start + 1, current);
        int length = digits.length();
        if (length != 3 && length != 6 && length != 8) {
            throw new ParseException(startLocation(), "a hex color with 3, 6 or 8 digits", "'#" + digits + "'");
        }
        addToken(TokenType.HEX_COLOR, digits.toLowerCase());
    }

    private void number() {
        while (isDigit(peek())) advance();
        boolean fraction = false;
        if (peek() == '.' && isDigit(peekNext())) {
            fraction = true;
            advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        if (fraction) {
            addToken(TokenType.DOUBLE, Double.parseDouble(text));
            return;
        }
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ParseException(startLocation(), "an integer in 32-bit range", "'" + text + "'");
        }
        if (peek() == 'p' && peekNext() == 'x' && !isIdentifierPart(peekAt(current + 2))) {
            advance();
            advance();
            addToken(TokenType.PIXELS, value);
        } else {
            addToken(TokenType.INTEGER, value);
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        Object value = switch (type) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            default -> null;
        };
        addToken(type, value);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, fileName));
    }

    private ParseException unexpected(char c) {
        return new ParseException(startLocation(), "Unexpected character '" + c + "'");
    }

    private SourceLocation startLocation() {
        return new SourceLocation(fileName, startLine, startColumn);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return peekAt(current);
    }

    private char peekNext() {
        return peekAt(current + 1);
    }

    private char peekAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
