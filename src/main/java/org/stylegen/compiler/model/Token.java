package org.stylegen.compiler.model;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * A single lexical token.
 *
 * @param type     The token kind.
 * @param text     The raw source text of the token.
 * @param value    The literal value ({@link Integer}, {@link Double}, {@link String} or
 *                 {@link Boolean}) for literal tokens, otherwise {@code null}.
 * @param line     The 1-based line of the first character.
 * @param column   The 1-based column of the first character.
 * @param fileName The normalized path of the source file.
 */
public record Token(TokenType type, String text, Object value, int line, int column, String fileName) {

    public SourceLocation location() {
        return new SourceLocation(fileName, line, column);
    }

    /**
     * @return The token described for error messages, e.g. {@code 'foo'} or "the end of the file".
     */
    public String describe() {
        if (type == TokenType.END_OF_FILE) {
            return type.description();
        }
        return "'" + text + "'";
    }
}
