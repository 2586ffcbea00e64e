package org.tinycompiler.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.tinycompiler.cli.commands.CompileCommand;
import org.tinycompiler.cli.config.ConfigLoader;
import org.tinycompiler.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tinyc",
    mixinStandardHelpOptions = true,
    version = "tinycompiler 1.0",
    description = "Compiles Lisp-style call expressions into C-style calls.",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved application configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            } catch (IllegalArgumentException | ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
