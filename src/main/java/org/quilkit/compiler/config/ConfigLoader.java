package org.quilkit.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the compiler configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "quilkit.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} in the working directory as the file source.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dquilkit.frontend.indent-width=2)
     * 3. Configuration File
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile The HOCON file to merge; skipped when it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}
