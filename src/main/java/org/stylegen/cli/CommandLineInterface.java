package org.stylegen.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.stylegen.cli.commands.CompileCommand;
import org.stylegen.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "stylegen",
    mixinStandardHelpOptions = true,
    version = "stylegen 1.0",
    description = "Compiles style sources into C++ headers",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/stylegen.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("stylegen");
        return commandLine;
    }

    /**
     * Loads the configuration on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the configured file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.info(message);
                    case WARN -> log.warn(message);
                }
            });
        }
        return config;
    }
}
