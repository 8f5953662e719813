package org.stylegen.compiler.frontend.parser.ast;

import org.stylegen.compiler.frontend.semantics.ModuleId;

import java.util.List;

/**
 * The parse result of one style source file. Immutable once parsed.
 *
 * @param id           The module identity (normalized file path).
 * @param imports      The {@code using} statements, in source order.
 * @param declarations Type and value declarations, in source order.
 */
public record SourceModule(ModuleId id, List<ImportNode> imports, List<DeclarationNode> declarations) {

    public SourceModule {
        imports = List.copyOf(imports);
        declarations = List.copyOf(declarations);
    }

    public List<TypeDeclarationNode> typeDeclarations() {
        return declarations.stream()
                .filter(TypeDeclarationNode.class::isInstance)
                .map(TypeDeclarationNode.class::cast)
                .toList();
    }

    public List<ValueDeclarationNode> valueDeclarations() {
        return declarations.stream()
                .filter(ValueDeclarationNode.class::isInstance)
                .map(ValueDeclarationNode.class::cast)
                .toList();
    }
}
