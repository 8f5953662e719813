package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.diagnostics.SourceLocation;

/**
 * A {@code using "path";} statement.
 *
 * @param path     The path as written, relative to the importing file.
 * @param location The position of the {@code using} keyword.
 */
public record ImportNode(String path, SourceLocation location) implements AstNode {
}
