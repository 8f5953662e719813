package org.stylegen.compiler.diagnostics;

/**
 * Thrown by the lexer and parser on malformed syntax.
 */
public class ParseException extends StyleCompilationException {

    private final String expected;

    /**
     * @param location Position of the offending token.
     * @param expected Description of what the parser expected at this position.
     * @param actual   Description of what was found instead.
     */
    public ParseException(SourceLocation location, String expected, String actual) {
        super(CompilerErrorCode.PARSE_ERROR, location, "expected " + expected + ", but got " + actual);
        this.expected = expected;
    }

    /**
     * Creates a parse error with a free-form message.
     *
     * @param location Position of the offending token.
     * @param message  The message.
     */
    public ParseException(SourceLocation location, String message) {
        super(CompilerErrorCode.PARSE_ERROR, location, message);
        this.expected = null;
    }

    /**
     * @return The expected-token description, or {@code null} for free-form parse errors.
     */
    public String expected() {
        return expected;
    }
}
