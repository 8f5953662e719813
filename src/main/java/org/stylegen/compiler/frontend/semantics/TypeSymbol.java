package org.stylegen.compiler.frontend.semantics;

import org.stylegen.compiler.frontend.parser.ast.TypeDeclarationNode;

/**
 * A registered structure type.
 *
 * @param name        The type name.
 * @param module      The declaring module.
 * @param declaration The declaration node.
 */
public record TypeSymbol(String name, ModuleId module, TypeDeclarationNode declaration) {
}
