package org.stylegen.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.stylegen.cli.CommandLineInterface;
import org.stylegen.compiler.CompilationResult;
import org.stylegen.compiler.CompilerOptions;
import org.stylegen.compiler.StyleCompiler;
import org.stylegen.compiler.backend.codegen.GeneratorOptions;
import org.stylegen.compiler.diagnostics.StyleCompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Compiles a root style file and its imports into C++ headers.
 * <p>
 * Exit codes: 0 on success, 1 on a compile error (reported as
 * {@code file:line:column: error[CODE]: message}), 2 on configuration or I/O problems.
 */
@Command(
    name = "compile",
    description = "Compile a style file and its imports into C++ headers"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_FAILURE = 2;

    @Parameters(
        index = "0",
        paramLabel = "ROOT",
        description = "The root style file"
    )
    private Path rootFile;

    @Option(
        names = {"-a", "--assets"},
        description = "Icon assets directory (default: stylegen.assets.root)"
    )
    private Path assetsRoot;

    @Option(
        names = {"-p", "--palette"},
        description = "Palette file colors are looked up in (default: stylegen.palette.file)"
    )
    private Path paletteFile;

    @Option(
        names = {"-o", "--out"},
        description = "Output directory (default: stylegen.output.directory)"
    )
    private Path outputDirectory;

    @Option(
        names = {"--no-manifest"},
        description = "Do not write icons.manifest.json"
    )
    private boolean noManifest;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompilerOptions options;
        GeneratorOptions generatorOptions;
        try {
            Config config = parent.getConfig().getConfig("stylegen");
            options = applyOverrides(CompilerOptions.fromConfig(config));
            generatorOptions = GeneratorOptions.fromConfig(config.getConfig("generator"));
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        try (StyleCompiler compiler = StyleCompiler.create(options, generatorOptions)) {
            CompilationResult result = compiler.compile(rootFile);
            List<Path> written = compiler.write(result);
            for (Path file : written) {
                out.println("Generated " + file);
            }
            out.flush();
            return EXIT_OK;
        } catch (StyleCompilationException e) {
            log.debug("Compilation failed", e);
            err.println(e.format());
            err.flush();
            return EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }

    private CompilerOptions applyOverrides(CompilerOptions options) {
        CompilerOptions result = options;
        if (assetsRoot != null) {
            result = result.withAssetsRoot(assetsRoot);
        }
        if (paletteFile != null) {
            result = result.withPaletteFile(paletteFile);
        }
        if (outputDirectory != null) {
            result = result.withOutputDirectory(outputDirectory);
        }
        if (noManifest) {
            result = result.withWriteManifest(false);
        }
        return result;
    }
}
