package org.stylegen.compiler.frontend.module;

import org.stylegen.compiler.diagnostics.CyclicImportException;
import org.stylegen.compiler.diagnostics.DuplicateDeclarationException;
import org.stylegen.compiler.diagnostics.ModuleNotFoundException;
import org.stylegen.compiler.frontend.parser.ast.SourceModule;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests loading of the {@code using} closure and the resulting module graph.
 */
public class ModuleGraphResolverTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private static List<String> stems(CompilationUnit unit) {
        return unit.topologicalOrder().stream().map(m -> m.id().stem()).toList();
    }

    @Test
    @Tag("integration")
    void singleFileProducesSingleModule() throws IOException {
        Path root = write("main.style", "gap: 4px;\n");

        CompilationUnit unit = new ModuleGraphResolver().resolve(root);

        assertThat(unit.topologicalOrder()).hasSize(1);
        assertThat(unit.root().path()).endsWith("/main.style");
        assertThat(unit.namespace()).containsOnlyKeys("gap");
    }

    @Test
    @Tag("integration")
    void importsComeBeforeImporters() throws IOException {
        write("lib/colors.style", "accent: #ff0000;\n");
        write("lib/base.style", "using \"colors.style\";\nBtn { height: pixels; }\n");
        Path root = write("main.style", "using \"lib/base.style\";\nbtn: Btn { height: 30px; }\n");

        CompilationUnit unit = new ModuleGraphResolver().resolve(root);

        assertThat(stems(unit)).containsExactly("colors", "base", "main");
        assertThat(unit.namespace().keySet()).containsExactly("accent", "Btn", "btn");
    }

    @Test
    @Tag("integration")
    void diamondImportIsLoadedOnce() throws IOException {
        write("shared.style", "unit: 4px;\n");
        write("left.style", "using \"shared.style\";\nleftGap: 1px;\n");
        write("right.style", "using \"./shared.style\";\nrightGap: 2px;\n");
        Path root = write("main.style", "using \"left.style\";\nusing \"right.style\";\n");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompilationUnit unit = new ModuleGraphResolver(executor).resolve(root);

            assertThat(stems(unit)).containsExactly("shared", "left", "right", "main");
            ModuleId main = unit.root();
            assertThat(unit.directImports().get(main)).extracting(ModuleId::stem).containsExactly("left", "right");
            assertThat(unit.visibleModules().get(main)).hasSize(4);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Tag("integration")
    void visibilityIsTransitiveAlongImportsOnly() throws IOException {
        write("a.style", "aValue: 1px;\n");
        write("b.style", "using \"a.style\";\n");
        write("c.style", "cValue: 2px;\n");
        Path root = write("main.style", "using \"b.style\";\nusing \"c.style\";\n");

        CompilationUnit unit = new ModuleGraphResolver().resolve(root);

        SourceModule b = unit.topologicalOrder().stream().filter(m -> m.id().stem().equals("b")).findFirst().orElseThrow();
        assertThat(unit.visibleModules().get(b.id())).extracting(ModuleId::stem).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @Tag("integration")
    void cyclicImportIsReportedWithPath() throws IOException {
        write("a.style", "using \"b.style\";\n");
        write("b.style", "using \"a.style\";\n");
        Path root = write("main.style", "using \"a.style\";\n");

        assertThatThrownBy(() -> new ModuleGraphResolver().resolve(root))
                .isInstanceOf(CyclicImportException.class)
                .hasMessageContaining("a.style -> ")
                .hasMessageContaining("b.style -> ");
    }

    @Test
    @Tag("integration")
    void missingImportReportsImportLocation() throws IOException {
        Path root = write("main.style", "gap: 1px;\n");
        Files.writeString(root, "using \"missing.style\";\n");

        assertThatThrownBy(() -> new ModuleGraphResolver().resolve(root))
                .isInstanceOf(ModuleNotFoundException.class)
                .satisfies(e -> {
                    ModuleNotFoundException notFound = (ModuleNotFoundException) e;
                    assertThat(notFound.location().file()).endsWith("main.style");
                    assertThat(notFound.location().line()).isEqualTo(1);
                });
    }

    @Test
    @Tag("integration")
    void missingRootIsReported() {
        assertThatThrownBy(() -> new ModuleGraphResolver().resolve(tempDir.resolve("nope.style")))
                .isInstanceOf(ModuleNotFoundException.class);
    }

    @Test
    @Tag("integration")
    void sameNameInTwoModulesIsDuplicate() throws IOException {
        write("lib.style", "gap: 1px;\n");
        Path root = write("main.style", "using \"lib.style\";\ngap: 2px;\n");

        assertThatThrownBy(() -> new ModuleGraphResolver().resolve(root))
                .isInstanceOf(DuplicateDeclarationException.class)
                .hasMessageContaining("gap");
    }
}
