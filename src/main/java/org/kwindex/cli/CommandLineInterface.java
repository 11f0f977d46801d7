package org.kwindex.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.kwindex.cli.commands.LookupCommand;
import org.kwindex.cli.commands.UsageCommand;
import org.kwindex.cli.config.ConfigLoader;
import org.kwindex.cli.config.LoggingConfigurator;
import org.kwindex.runtime.RuntimeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "kwindex",
    mixinStandardHelpOptions = true,
    version = "kwindex 1.0",
    description = "Resolve keywords against tables and render usage errors",
    subcommands = {
        LookupCommand.class,
        UsageCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/kwindex.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private RuntimeSettings settings;
    private boolean initialized = false;

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
        commandLine.setCommandName("kwindex");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            final Config config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
            LoggingConfigurator.configure(config);
            this.settings = RuntimeSettings.fromConfig(config);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load or parse configuration: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        initialized = true;
    }

    public RuntimeSettings getSettings() {
        if (!initialized) {
            initialize();
        }
        return settings;
    }
}
