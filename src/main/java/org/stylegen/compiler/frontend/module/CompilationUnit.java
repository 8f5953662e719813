package org.stylegen.compiler.frontend.module;

import org.stylegen.compiler.frontend.parser.ast.SourceModule;
import org.stylegen.compiler.frontend.semantics.ModuleId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The output of module graph resolution: every module reachable from the root,
 * in topological order (dependencies before dependents), plus the flattened namespace.
 *
 * @param root             The module the compilation started from.
 * @param topologicalOrder Modules sorted so that every module appears after its imports.
 * @param directImports    Module to the modules its {@code using} statements name, in source order.
 * @param visibleModules   Module to itself plus its transitive imports.
 * @param namespace        Every top-level declaration by name, in topological order.
 */
public record CompilationUnit(
        ModuleId root,
        List<SourceModule> topologicalOrder,
        Map<ModuleId, List<ModuleId>> directImports,
        Map<ModuleId, Set<ModuleId>> visibleModules,
        Map<String, QualifiedDeclaration> namespace
) {

    public CompilationUnit {
        topologicalOrder = List.copyOf(topologicalOrder);
        directImports = Map.copyOf(directImports);
        visibleModules = Map.copyOf(visibleModules);
        namespace = Collections.unmodifiableMap(new LinkedHashMap<>(namespace));
    }

    /**
     * @return The declarations of all modules in topological and source order.
     */
    public List<QualifiedDeclaration> declarations() {
        return List.copyOf(namespace.values());
    }
}
