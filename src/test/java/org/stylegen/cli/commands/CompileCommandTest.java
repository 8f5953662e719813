package org.stylegen.cli.commands;

import org.stylegen.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the compile subcommand end to end through picocli, including exit codes and
 * the error report format.
 */
public class CompileCommandTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private Path assets;
    private Path out;
    private final StringWriter stdout = new StringWriter();
    private final StringWriter stderr = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        configFile = tempDir.resolve("stylegen.conf");
        Files.writeString(configFile, "stylegen.compiler.parallelism = 1\n");
        assets = Files.createDirectories(tempDir.resolve("assets"));
        out = tempDir.resolve("out");
    }

    private int run(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(stdout));
        commandLine.setErr(new PrintWriter(stderr));
        return commandLine.execute(args);
    }

    private Path style(String content) throws IOException {
        Path file = tempDir.resolve("main.style");
        Files.writeString(file, content);
        return file;
    }

    @Test
    @Tag("integration")
    void successfulCompileListsGeneratedFiles() throws IOException {
        Path root = style("Btn { height: pixels; }\nbtn: Btn { height: 30px; }\n");

        int exitCode = run("--config", configFile.toString(), "compile", root.toString(),
                "-a", assets.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(stdout.toString()).contains("Generated " + out.resolve("style_main.h"));
        assertThat(stdout.toString()).contains("icons.manifest.json");
        assertThat(out.resolve("style_main.h")).exists();
    }

    @Test
    @Tag("integration")
    void noManifestSkipsTheManifest() throws IOException {
        Path root = style("gap: 1px;\n");

        int exitCode = run("--config", configFile.toString(), "compile", root.toString(),
                "--assets", assets.toString(), "--out", out.toString(), "--no-manifest");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(out.resolve("icons.manifest.json")).doesNotExist();
    }

    @Test
    @Tag("integration")
    void compileErrorIsReportedWithLocationAndCode() throws IOException {
        Path root = style("Btn { height: pixels; }\nbtn: Btn { height: wide; }\n");

        int exitCode = run("--config", configFile.toString(), "compile", root.toString(),
                "-a", assets.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_COMPILE_ERROR);
        assertThat(stderr.toString()).contains("main.style:2:20: error[UNDEFINED_NAME]: ");
        assertThat(out).doesNotExist();
    }

    @Test
    @Tag("integration")
    void paletteOptionSuppliesColors() throws IOException {
        Path palette = tempDir.resolve("palette.colors");
        Files.writeString(palette, "brand: #ff0000;\n");
        Path root = style("Label { color: color; }\ntitle: Label { color: brand; }\n");

        int exitCode = run("--config", configFile.toString(), "compile", root.toString(),
                "-a", assets.toString(), "-o", out.toString(), "-p", palette.toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(Files.readString(out.resolve("style_main.h"))).contains(".color = style::color(255, 0, 0, 255),");
    }

    @Test
    @Tag("integration")
    void missingPaletteIsAFailure() throws IOException {
        Path root = style("gap: 1px;\n");

        int exitCode = run("--config", configFile.toString(), "compile", root.toString(),
                "-o", out.toString(), "-p", tempDir.resolve("missing.colors").toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_FAILURE);
        assertThat(stderr.toString()).startsWith("Error: ");
    }

    @Test
    @Tag("integration")
    void missingConfigFileIsAFailure() throws IOException {
        Path root = style("gap: 1px;\n");

        int exitCode = run("--config", tempDir.resolve("absent.conf").toString(), "compile", root.toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_FAILURE);
        assertThat(stderr.toString()).contains("Configuration file not found");
    }

    @Test
    @Tag("unit")
    void helpListsTheCompileCommand() {
        int exitCode = run("help");

        assertThat(exitCode).isEqualTo(0);
        assertThat(stdout.toString()).contains("compile");
    }
}
