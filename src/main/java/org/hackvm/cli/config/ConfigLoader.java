package org.hackvm.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "hackvm.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dtranslator.stack-base=512)
     * 2. Environment Variables
     * 3. Configuration File (the explicit file if given, otherwise hackvm.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file passed on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException.IO if the explicit file does not exist.
     * @throws ConfigException if a file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new ConfigException.IO(ConfigOriginFactory.newSimple(explicitFile.getPath()),
                        "Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from file given via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.debug("Loading configuration from file: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults from classpath.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
