package org.stylegen.compiler.frontend.parser.features.icon;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * An {@code icon{ {"path", color}, ... }} expression. Layers are kept in source order,
 * which is also the painting order (first layer at the bottom).
 */
public record IconNode(List<IconEntryNode> layers, SourceLocation location) implements ExpressionNode {

    public IconNode {
        layers = List.copyOf(layers);
    }
}
