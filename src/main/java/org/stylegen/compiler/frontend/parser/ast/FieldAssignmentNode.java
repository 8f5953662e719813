package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.model.Token;

/**
 * One {@code field: expression;} line inside a value block.
 *
 * @param name  The field name.
 * @param value The assigned expression.
 */
public record FieldAssignmentNode(Token name, ExpressionNode value) implements AstNode {

    @Override
    public SourceLocation location() {
        return name.location();
    }
}
