package org.stylegen.compiler.frontend.module;

import org.stylegen.compiler.frontend.parser.ast.DeclarationNode;
import org.stylegen.compiler.frontend.semantics.ModuleId;

/**
 * A declaration together with the module it was declared in.
 *
 * @param module      The declaring module.
 * @param declaration The declaration node.
 */
public record QualifiedDeclaration(ModuleId module, DeclarationNode declaration) {

    public String name() {
        return declaration.nameText();
    }
}
