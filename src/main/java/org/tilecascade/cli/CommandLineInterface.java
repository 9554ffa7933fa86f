package org.tilecascade.cli;

import com.typesafe.config.Config;
import org.tilecascade.cli.commands.NormalizeCommand;
import org.tilecascade.cli.commands.PlayCommand;
import org.tilecascade.cli.config.ConfigLoader;
import org.tilecascade.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tilecascade",
    mixinStandardHelpOptions = true,
    version = "Tile Cascade 1.0",
    description = "Tile Cascade - match-three round engine",
    subcommands = {
        NormalizeCommand.class,
        PlayCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tilecascade");
        System.exit(commandLine.execute(args));
    }

    /**
     * Gets the merged configuration, loading it and applying its logging settings on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file given with {@code --config} does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
