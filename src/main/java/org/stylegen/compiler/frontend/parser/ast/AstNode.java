package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * Base interface of all nodes of the style syntax tree. Nodes are immutable.
 */
public interface AstNode {

    /**
     * @return The position of the first token of this node.
     */
    SourceLocation location();
}
