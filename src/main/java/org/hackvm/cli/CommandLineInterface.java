package org.hackvm.cli;

import com.typesafe.config.Config;
import org.hackvm.cli.commands.TranslateCommand;
import org.hackvm.cli.config.ConfigLoader;
import org.hackvm.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "hackvm",
    mixinStandardHelpOptions = true,
    version = "hackvm-translator 1.0",
    description = "Translates stack VM programs into Hack assembly.",
    subcommands = {
        TranslateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
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
        System.exit(newCommandLine().execute(args));
    }

    /**
     * @return A command line with the root command and all subcommands registered.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("hackvm");
        commandLine.setExecutionExceptionHandler(CommandLineInterface::handleUnexpected);
        return commandLine;
    }

    /**
     * Logs a failure that escaped a command and maps it to {@link TranslateCommand#EXIT_IO_ERROR}.
     */
    static int handleUnexpected(final Exception e, final CommandLine commandLine, final CommandLine.ParseResult parseResult) {
        log.error("Unexpected error in '{}': {}", commandLine.getCommandName(), e.toString(), e);
        return TranslateCommand.EXIT_IO_ERROR;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
