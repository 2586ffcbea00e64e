package org.tinycompiler.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "tinycompiler.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dtinycompiler.emitter.indent=...)
     * 2. Environment Variables
     * 3. Configuration File (tinycompiler.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            return combine(ConfigFactory.parseFile(configFile));
        }
        LOG.debug("Configuration file '{}' not found. Using classpath defaults.", configFile.getPath());
        return combine(ConfigFactory.empty());
    }

    /**
     * Loads the application configuration with an explicitly chosen file in place of
     * the working-directory file.
     *
     * @param configFile The configuration file; it must exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if the file does not exist.
     */
    public static Config load(final File configFile) {
        if (!configFile.isFile()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
        return combine(ConfigFactory.parseFile(configFile));
    }

    /**
     * Loads the application configuration with a classpath resource in place of
     * the working-directory file.
     *
     * @param resourceName The classpath resource, e.g. {@code org/tinycompiler/cli/config/test-config.conf}.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourceName) {
        return combine(ConfigFactory.parseResources(resourceName));
    }

    private static Config combine(final Config fileConfig) {
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}
