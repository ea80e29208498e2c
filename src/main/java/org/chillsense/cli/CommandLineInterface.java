package org.chillsense.cli;

import java.io.File;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.chillsense.cli.commands.HoverCommand;
import org.chillsense.cli.commands.ServeCommand;
import org.chillsense.cli.commands.SymbolsCommand;
import org.chillsense.cli.config.ConfigLoader;
import org.chillsense.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "chillsense",
    mixinStandardHelpOptions = true,
    version = "chillsense 1.0.0",
    description = "CHILL (ITU-T Z.200) symbol analyzer and language server",
    subcommands = {
        ServeCommand.class,
        SymbolsCommand.class,
        HoverCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Editors start the language server with:",
        "",
        "    chillsense serve"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/chillsense.conf)"
    )
    private File configFile;

    private Config config;
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
        commandLine.setCommandName("chillsense");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> log.info(message);
                case WARN -> log.warn(message);
            }
        });

        // stdout belongs to the protocol or the command output, so every appender writes to stderr
        System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, LoggingConfigurator.appenderName(config));
        reconfigureLogback();
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the application configuration, loading it and setting up logging on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed or resolved.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Like {@link #getConfig()}, but reports failures through the log instead of throwing.
     * Subcommands turn an empty result into exit code 1.
     *
     * @return The configuration, or empty if it could not be loaded.
     */
    public Optional<Config> loadConfig() {
        try {
            return Optional.of(getConfig());
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
        } catch (ConfigException e) {
            log.error("Failed to load or parse configuration: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
