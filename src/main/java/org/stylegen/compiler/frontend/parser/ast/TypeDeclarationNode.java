package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.model.Token;

import java.util.List;

/**
 * A structure type declaration, e.g. {@code Btn { height: pixels; bg: color; }}.
 *
 * @param name   The type name (upper-case initial).
 * @param fields The fields in declaration order.
 */
public record TypeDeclarationNode(Token name, List<FieldDeclarationNode> fields) implements DeclarationNode {

    public TypeDeclarationNode {
        fields = List.copyOf(fields);
    }
}
