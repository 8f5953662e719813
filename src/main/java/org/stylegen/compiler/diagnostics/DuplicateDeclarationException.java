package org.stylegen.compiler.diagnostics;

/**
 * Thrown when a top-level name, a structure field or a field assignment is declared twice.
 * The message names both origins.
 */
public class DuplicateDeclarationException extends StyleCompilationException {

    private final String name;
    private final SourceLocation firstOrigin;

    /**
     * @param location    The second (offending) declaration.
     * @param name        The duplicated name.
     * @param firstOrigin The first declaration of the name.
     */
    public DuplicateDeclarationException(SourceLocation location, String name, SourceLocation firstOrigin) {
        super(CompilerErrorCode.DUPLICATE_DECLARATION, location,
                "'" + name + "' is declared at " + location + " but was already declared at " + firstOrigin);
        this.name = name;
        this.firstOrigin = firstOrigin;
    }

    public String name() {
        return name;
    }

    public SourceLocation firstOrigin() {
        return firstOrigin;
    }
}
