package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.model.Token;

/**
 * One {@code field: type;} line of a structure type declaration.
 *
 * @param name     The field name.
 * @param typeName The type: a built-in keyword or a structure type name.
 */
public record FieldDeclarationNode(Token name, Token typeName) implements AstNode {

    @Override
    public SourceLocation location() {
        return name.location();
    }
}
