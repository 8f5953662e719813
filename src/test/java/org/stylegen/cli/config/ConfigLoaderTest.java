package org.stylegen.cli.config;

import com.typesafe.config.Config;
import org.stylegen.compiler.CompilerOptions;
import org.stylegen.compiler.backend.codegen.GeneratorOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the layered configuration and the option records read from it.
 */
public class ConfigLoaderTest {

    private static File testConfig() throws URISyntaxException {
        return Path.of(ConfigLoaderTest.class.getResource("/test-config.conf").toURI()).toFile();
    }

    @Test
    @Tag("unit")
    void defaultsComeFromReferenceConf() {
        Config config = ConfigLoader.loadDefaults().getConfig("stylegen");

        CompilerOptions options = CompilerOptions.fromConfig(config);
        assertThat(options.assetsRoot()).isEqualTo(Path.of("assets"));
        assertThat(options.paletteFile()).isEmpty();
        assertThat(options.outputDirectory()).isEqualTo(Path.of("generated"));
        assertThat(options.writeManifest()).isTrue();
        assertThat(options.parallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(GeneratorOptions.fromConfig(config.getConfig("generator"))).isEqualTo(GeneratorOptions.defaults());
    }

    @Test
    @Tag("unit")
    void fileOverridesOnlyTheKeysItSets() throws URISyntaxException {
        Config config = ConfigLoader.loadFromFile(testConfig()).getConfig("stylegen");

        CompilerOptions options = CompilerOptions.fromConfig(config);
        GeneratorOptions generator = GeneratorOptions.fromConfig(config.getConfig("generator"));
        assertThat(options.writeManifest()).isFalse();
        assertThat(options.parallelism()).isEqualTo(2);
        assertThat(options.outputDirectory()).isEqualTo(Path.of("generated"));
        assertThat(generator.headerPrefix()).isEqualTo("test_");
        assertThat(generator.valuesNamespace()).isEqualTo("st");
    }

    @Test
    @Tag("unit")
    void explicitFileIsReported() throws URISyntaxException {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testConfig(), (level, message) -> messages.add(level + " " + message));

        assertThat(config.getInt("stylegen.compiler.parallelism")).isEqualTo(2);
        assertThat(messages).singleElement().asString().startsWith("INFO Using configuration file specified via --config");
    }

    @Test
    @Tag("unit")
    void missingExplicitFileIsRejected(@TempDir Path dir) {
        File missing = dir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, (level, message) -> { }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.conf");
    }

    @Test
    @Tag("unit")
    void zeroParallelismIsRejected() {
        assertThatThrownBy(() -> new CompilerOptions(Path.of("a"), Optional.empty(), Path.of("o"), true, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
