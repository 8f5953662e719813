package org.stylegen.compiler;

import org.stylegen.compiler.backend.codegen.CppCodeGenerator;
import org.stylegen.compiler.backend.codegen.GeneratorOptions;
import org.stylegen.compiler.backend.output.AssetManifestWriter;
import org.stylegen.compiler.backend.output.OutputWriter;
import org.stylegen.compiler.color.ColorSource;
import org.stylegen.compiler.color.PaletteColorSource;
import org.stylegen.compiler.frontend.module.CompilationUnit;
import org.stylegen.compiler.frontend.module.ModuleGraphResolver;
import org.stylegen.compiler.frontend.resolve.ResolutionEngine;
import org.stylegen.compiler.frontend.resolve.ResolvedUnit;
import org.stylegen.compiler.frontend.semantics.SymbolTable;
import org.stylegen.compiler.icons.AssetFileSystem;
import org.stylegen.compiler.icons.IconAssetResolver;
import org.stylegen.compiler.icons.LocalAssetFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the whole pipeline: module graph, symbol table, value resolution, code generation and,
 * on request, output. The compiler owns a worker pool for parsing and icon probing; close it
 * when done.
 *
 * <p>Compilation fails on the first error with a
 * {@link org.stylegen.compiler.diagnostics.StyleCompilationException}. Nothing is written
 * unless the whole unit compiled.</p>
 */
public class StyleCompiler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StyleCompiler.class);

    private final CompilerOptions options;
    private final CppCodeGenerator generator;
    private final ColorSource colors;
    private final AssetFileSystem assets;
    private final ExecutorService executor;

    /**
     * @param options          The compiler options.
     * @param generatorOptions The C++ naming options.
     * @param colors           The color table.
     * @param assets           The assets directory.
     */
    public StyleCompiler(CompilerOptions options, GeneratorOptions generatorOptions, ColorSource colors,
                         AssetFileSystem assets) {
        this.options = options;
        this.generator = new CppCodeGenerator(generatorOptions);
        this.colors = colors;
        this.assets = assets;
        this.executor = Executors.newFixedThreadPool(options.parallelism(), new WorkerThreadFactory());
    }

    /**
     * Creates a compiler that reads the palette and assets named in the options.
     *
     * @param options          The compiler options.
     * @param generatorOptions The C++ naming options.
     * @return The compiler.
     * @throws IOException if the palette file cannot be read.
     */
    public static StyleCompiler create(CompilerOptions options, GeneratorOptions generatorOptions) throws IOException {
        ColorSource colors = options.paletteFile().isPresent()
                ? PaletteColorSource.load(options.paletteFile().get())
                : ColorSource.empty();
        return new StyleCompiler(options, generatorOptions, colors, new LocalAssetFileSystem(options.assetsRoot()));
    }

    /**
     * Compiles a root style file and everything it imports.
     *
     * @param rootFile The root style file.
     * @return The resolved unit and generated headers.
     * @throws org.stylegen.compiler.diagnostics.StyleCompilationException on the first compile error.
     */
    public CompilationResult compile(Path rootFile) {
        long start = System.nanoTime();

        CompilationUnit unit = new ModuleGraphResolver(executor).resolve(rootFile);
        SymbolTable symbols = SymbolTable.from(unit);
        ResolutionEngine engine = new ResolutionEngine(symbols, colors, new IconAssetResolver(assets, executor));
        ResolvedUnit resolved = new ResolvedUnit(unit, symbols, engine.resolveAll());
        CompilationResult result = new CompilationResult(resolved, generator.generate(resolved));

        log.info("Compiled {} module(s), {} value(s) in {} ms", unit.topologicalOrder().size(),
                resolved.values().size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return result;
    }

    /**
     * Writes the headers and, if enabled, the icon manifest into the output directory. All
     * files are staged before any is moved into place, so a failed write keeps the previous
     * headers and manifest together.
     *
     * @param result A successful compilation.
     * @return The written files.
     * @throws IOException if writing fails.
     */
    public List<Path> write(CompilationResult result) throws IOException {
        Map<String, String> contents = new LinkedHashMap<>();
        result.files().forEach(file -> contents.put(file.fileName(), file.content()));
        if (options.writeManifest()) {
            String root = assets instanceof LocalAssetFileSystem local
                    ? local.root().toString().replace('\\', '/')
                    : options.assetsRoot().toString();
            contents.put(AssetManifestWriter.FILE_NAME, new AssetManifestWriter().toJson(result.unit(), root));
        }
        return new OutputWriter().writeAll(contents, options.outputDirectory());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "stylegen-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
