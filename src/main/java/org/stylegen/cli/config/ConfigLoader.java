package org.stylegen.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the HOCON configuration of the command line.
 * <p>
 * Layers, highest priority first:
 * <ol>
 *   <li>Java system properties ({@code -Dstylegen.output.directory=...})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are merged, so an override of a value that
 * {@code reference.conf} refers to is seen everywhere it is used.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "stylegen.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads the layered configuration. The file is
     * taken from the first of:
     * <ol>
     *   <li>the {@code --config} option,</li>
     *   <li>the {@code -Dconfig.file} system property,</li>
     *   <li>{@code config/stylegen.conf} in the working directory.</li>
     * </ol>
     * Without any, only {@code reference.conf} and the overrides apply.
     *
     * @param explicitConfigFile The file from {@code --config}, or {@code null}.
     * @param handler            Receives progress messages.
     * @return The resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found. Using default configuration.");
        return loadDefaults();
    }

    /**
     * @param configFile The user configuration file.
     * @return The configuration of the file merged over the defaults, under the overrides.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * @return The defaults under the overrides.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }
}
