package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.model.Token;

import java.util.List;
import java.util.Optional;

/**
 * A value declaration in one of its three forms (see {@link ValueForm}).
 *
 * @param name        The value name (lower-case initial).
 * @param form        The surface form.
 * @param typeName    The declared structure type, present only for {@link ValueForm#STRUCTURE}.
 * @param baseName    The base value to inherit from, optional for {@link ValueForm#STRUCTURE}.
 * @param assignments The field assignments in source order; empty for {@link ValueForm#SIMPLE}.
 * @param simpleValue The expression of a {@link ValueForm#SIMPLE} value.
 */
public record ValueDeclarationNode(
        Token name,
        ValueForm form,
        Optional<Token> typeName,
        Optional<Token> baseName,
        List<FieldAssignmentNode> assignments,
        Optional<ExpressionNode> simpleValue
) implements DeclarationNode {

    public ValueDeclarationNode {
        assignments = List.copyOf(assignments);
    }

    public static ValueDeclarationNode structure(Token name, Token typeName, Token baseName,
                                                 List<FieldAssignmentNode> assignments) {
        return new ValueDeclarationNode(name, ValueForm.STRUCTURE, Optional.of(typeName),
                Optional.ofNullable(baseName), assignments, Optional.empty());
    }

    public static ValueDeclarationNode anonymous(Token name, List<FieldAssignmentNode> assignments) {
        return new ValueDeclarationNode(name, ValueForm.ANONYMOUS, Optional.empty(), Optional.empty(),
                assignments, Optional.empty());
    }

    public static ValueDeclarationNode simple(Token name, ExpressionNode value) {
        return new ValueDeclarationNode(name, ValueForm.SIMPLE, Optional.empty(), Optional.empty(),
                List.of(), Optional.of(value));
    }
}
