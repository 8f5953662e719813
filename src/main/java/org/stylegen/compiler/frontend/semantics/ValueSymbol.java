package org.stylegen.compiler.frontend.semantics;

import org.stylegen.compiler.frontend.parser.ast.ValueDeclarationNode;

/**
 * A registered, not yet resolved value declaration.
 *
 * @param name        The value name.
 * @param module      The declaring module.
 * @param declaration The declaration node.
 */
public record ValueSymbol(String name, ModuleId module, ValueDeclarationNode declaration) {
}
