package org.stylegen.compiler.diagnostics;

/**
 * Thrown when a field of a value's declared type is assigned neither by a base nor locally.
 */
public class MissingFieldException extends StyleCompilationException {

    private final String valueName;
    private final String field;

    public MissingFieldException(SourceLocation location, String valueName, String field) {
        super(CompilerErrorCode.MISSING_FIELD, location,
                "Value '" + valueName + "' does not assign field '" + field + "'");
        this.valueName = valueName;
        this.field = field;
    }

    public String valueName() {
        return valueName;
    }

    public String field() {
        return field;
    }
}
