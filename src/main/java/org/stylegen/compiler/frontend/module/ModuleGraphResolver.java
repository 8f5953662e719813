package org.stylegen.compiler.frontend.module;

import org.stylegen.compiler.diagnostics.CyclicImportException;
import org.stylegen.compiler.diagnostics.DuplicateDeclarationException;
import org.stylegen.compiler.diagnostics.ModuleNotFoundException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.io.SourceLoader;
import org.stylegen.compiler.frontend.lexer.Lexer;
import org.stylegen.compiler.frontend.parser.Parser;
import org.stylegen.compiler.frontend.parser.ast.DeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.ImportNode;
import org.stylegen.compiler.frontend.parser.ast.SourceModule;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.util.Concurrency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Loads a root style file and its transitive {@code using} closure and builds a
 * {@link CompilationUnit}.
 *
 * <p>Files are discovered in waves: all files first referenced by the previous wave are
 * lexed and parsed in parallel on the given executor, then joined in reference order so the
 * result does not depend on scheduling. A file reached through several paths (diamond
 * imports) is parsed once. After loading, the graph is checked for cycles, sorted
 * topologically and flattened into one namespace.</p>
 */
public final class ModuleGraphResolver {

    private static final Logger log = LoggerFactory.getLogger(ModuleGraphResolver.class);

    private final Executor executor;

    /**
     * @param executor Executor used to parse the files of one discovery wave in parallel.
     */
    public ModuleGraphResolver(Executor executor) {
        this.executor = executor;
    }

    /**
     * Creates a resolver that parses on the calling thread.
     */
    public ModuleGraphResolver() {
        this(Runnable::run);
    }

    /**
     * Resolves the module graph starting at the given root file.
     *
     * @param rootFile The root style file.
     * @return The compilation unit with modules in topological order.
     * @throws ModuleNotFoundException        if the root or an imported file cannot be read.
     * @throws CyclicImportException          if the import graph contains a cycle.
     * @throws DuplicateDeclarationException  if a top-level name is declared twice.
     * @throws org.stylegen.compiler.diagnostics.ParseException on syntax errors.
     */
    public CompilationUnit resolve(Path rootFile) {
        Path normalized = SourceLoader.normalize(rootFile);
        ModuleId rootId = new ModuleId(SourceLoader.logicalName(normalized));

        Map<ModuleId, SourceModule> modules = loadClosure(rootId);
        Map<ModuleId, List<ModuleId>> directImports = new LinkedHashMap<>();
        for (SourceModule module : modules.values()) {
            directImports.put(module.id(), importedIds(module));
        }

        List<ModuleId> order = topologicalSort(rootId, modules);
        Map<ModuleId, Set<ModuleId>> visibility = computeVisibility(order, directImports);

        List<SourceModule> sorted = order.stream().map(modules::get).toList();
        Map<String, QualifiedDeclaration> namespace = flatten(sorted);

        log.debug("Resolved {} style module(s) from {}", sorted.size(), rootId);
        return new CompilationUnit(rootId, sorted, directImports, visibility, namespace);
    }

    private Map<ModuleId, SourceModule> loadClosure(ModuleId rootId) {
        Map<ModuleId, SourceModule> loaded = new LinkedHashMap<>();
        Map<ModuleId, SourceLocation> referencedFrom = new LinkedHashMap<>();
        referencedFrom.put(rootId, SourceLocation.ofFile(rootId.path()));

        List<ModuleId> wave = List.of(rootId);
        while (!wave.isEmpty()) {
            List<CompletableFuture<SourceModule>> futures = new ArrayList<>();
            for (ModuleId id : wave) {
                SourceLocation origin = referencedFrom.get(id);
                futures.add(CompletableFuture.supplyAsync(() -> load(id, origin), executor));
            }

            List<ModuleId> next = new ArrayList<>();
            for (CompletableFuture<SourceModule> future : futures) {
                SourceModule module = Concurrency.await(future);
                loaded.put(module.id(), module);
                for (ImportNode imp : module.imports()) {
                    ModuleId importId = resolveImport(module.id(), imp);
                    if (!referencedFrom.containsKey(importId)) {
                        referencedFrom.put(importId, imp.location());
                        next.add(importId);
                    }
                }
            }
            wave = next;
        }
        return loaded;
    }

    private SourceModule load(ModuleId id, SourceLocation origin) {
        SourceLoader.LoadResult result;
        try {
            result = SourceLoader.loadFile(Path.of(id.path()));
        } catch (IOException e) {
            throw new ModuleNotFoundException(origin, id.path(), e);
        }
        log.debug("Parsing style module {}", id);
        Lexer lexer = new Lexer(result.content(), id.path());
        return new Parser(lexer.scanTokens(), id).parse();
    }

    private static ModuleId resolveImport(ModuleId importer, ImportNode imp) {
        Path resolved = SourceLoader.resolveRelative(importer.path(), imp.path());
        return new ModuleId(SourceLoader.logicalName(resolved));
    }

    private static List<ModuleId> importedIds(SourceModule module) {
        List<ModuleId> ids = new ArrayList<>();
        for (ImportNode imp : module.imports()) {
            ModuleId id = resolveImport(module.id(), imp);
            if (!ids.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * Depth-first post-order walk following imports in source order. Modules on the current
     * path are tracked to report the full cycle when an import loops back to one of them.
     */
    private static List<ModuleId> topologicalSort(ModuleId rootId, Map<ModuleId, SourceModule> modules) {
        List<ModuleId> sorted = new ArrayList<>();
        Set<ModuleId> done = new LinkedHashSet<>();
        LinkedHashSet<ModuleId> visiting = new LinkedHashSet<>();
        visit(rootId, modules, visiting, done, sorted);
        return sorted;
    }

    private static void visit(ModuleId id, Map<ModuleId, SourceModule> modules,
                              LinkedHashSet<ModuleId> visiting, Set<ModuleId> done, List<ModuleId> sorted) {
        if (done.contains(id)) return;
        visiting.add(id);

        SourceModule module = modules.get(id);
        for (ImportNode imp : module.imports()) {
            ModuleId dependency = resolveImport(id, imp);
            if (visiting.contains(dependency)) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (ModuleId onPath : visiting) {
                    inCycle |= onPath.equals(dependency);
                    if (inCycle) cycle.add(onPath.path());
                }
                cycle.add(dependency.path());
                throw new CyclicImportException(imp.location(), "Cyclic import: " + String.join(" -> ", cycle));
            }
            visit(dependency, modules, visiting, done, sorted);
        }

        visiting.remove(id);
        done.add(id);
        sorted.add(id);
    }

    private static Map<ModuleId, Set<ModuleId>> computeVisibility(List<ModuleId> order,
                                                                  Map<ModuleId, List<ModuleId>> directImports) {
        Map<ModuleId, Set<ModuleId>> visibility = new LinkedHashMap<>();
        // Dependencies come first in topological order, so their closures are already complete.
        for (ModuleId id : order) {
            Set<ModuleId> visible = new LinkedHashSet<>();
            visible.add(id);
            for (ModuleId dependency : directImports.get(id)) {
                visible.addAll(visibility.get(dependency));
            }
            visibility.put(id, Collections.unmodifiableSet(visible));
        }
        return visibility;
    }

    private static Map<String, QualifiedDeclaration> flatten(List<SourceModule> sorted) {
        Map<String, QualifiedDeclaration> namespace = new LinkedHashMap<>();
        for (SourceModule module : sorted) {
            for (DeclarationNode declaration : module.declarations()) {
                QualifiedDeclaration previous = namespace.putIfAbsent(
                        declaration.nameText(), new QualifiedDeclaration(module.id(), declaration));
                if (previous != null) {
                    throw new DuplicateDeclarationException(declaration.location(), declaration.nameText(),
                            previous.declaration().location());
                }
            }
        }
        return namespace;
    }
}
