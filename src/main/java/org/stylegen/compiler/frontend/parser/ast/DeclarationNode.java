package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.model.Token;

/**
 * A top-level declaration: either a structure type or a value.
 */
public sealed interface DeclarationNode extends AstNode permits TypeDeclarationNode, ValueDeclarationNode {

    /**
     * @return The identifier token naming the declaration.
     */
    Token name();

    default String nameText() {
        return name().text();
    }

    @Override
    default SourceLocation location() {
        return name().location();
    }
}
