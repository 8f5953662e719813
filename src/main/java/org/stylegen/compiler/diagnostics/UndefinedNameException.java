package org.stylegen.compiler.diagnostics;

/**
 * Thrown when a type or value name cannot be found, or is declared in a module that the
 * referencing module does not import.
 */
public class UndefinedNameException extends StyleCompilationException {

    private final String name;

    public UndefinedNameException(SourceLocation location, String name, String message) {
        super(CompilerErrorCode.UNDEFINED_NAME, location, message);
        this.name = name;
    }

    public UndefinedNameException(SourceLocation location, String name) {
        this(location, name, "Undefined name '" + name + "'");
    }

    public String name() {
        return name;
    }
}
