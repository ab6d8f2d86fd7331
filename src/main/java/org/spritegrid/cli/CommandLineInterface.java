package org.spritegrid.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.spritegrid.cli.commands.InspectCommand;
import org.spritegrid.cli.commands.ProcessCommand;
import org.spritegrid.cli.commands.TextureCommand;
import org.spritegrid.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "spritegrid",
    mixinStandardHelpOptions = true,
    version = "spritegrid 1.0",
    description = "Post-processes generated 3x3 sprite atlases and injects them into STEX textures",
    subcommands = {
        ProcessCommand.class,
        InspectCommand.class,
        TextureCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "spritegrid.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: spritegrid.conf)"
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
        commandLine.setCommandName("spritegrid");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * <p>
     * Precedence: system properties, environment, then the first configuration file found among
     * {@code --config}, {@code -Dconfig.file} and {@code spritegrid.conf} in the working
     * directory, then the classpath defaults.
     *
     * @throws CommandLine.ParameterException if an explicitly named file is missing or unparsable.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final File file = resolveConfigFile();
        try {
            Config fileConfig = ConfigFactory.empty();
            if (file != null) {
                logger.debug("Using configuration file: {}", file.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(file);
            } else {
                logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
            }
            return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private File resolveConfigFile() {
        // 1) Highest precedence: explicit CLI option --config
        if (configFile != null) {
            return requireExisting(configFile, "--config");
        }
        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return requireExisting(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
        }
        // 3) Then: spritegrid.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }

    private File requireExisting(File file, String source) {
        if (!file.exists()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Configuration file specified via " + source + " was not found: " + file.getAbsolutePath());
        }
        return file;
    }
}
