package org.stylegen.compiler.diagnostics;

/**
 * Thrown when an assigned expression does not match the type its field expects.
 */
public class TypeMismatchException extends StyleCompilationException {

    private final String field;
    private final String expectedType;
    private final String actualType;

    /**
     * @param location     The offending assignment.
     * @param field        The field (or constructor argument) being assigned.
     * @param expectedType Display name of the expected type.
     * @param actualType   Display name of the type the expression produced.
     */
    public TypeMismatchException(SourceLocation location, String field, String expectedType, String actualType) {
        super(CompilerErrorCode.TYPE_MISMATCH, location,
                "Field '" + field + "' expects " + expectedType + " but got " + actualType);
        this.field = field;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String field() {
        return field;
    }

    public String expectedType() {
        return expectedType;
    }

    public String actualType() {
        return actualType;
    }
}
