package org.quilkit.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies logging settings from HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.quilkit.compiler.analysis" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The configuration containing an optional {@code logging} section.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            LOGGER.debug("SLF4J is not bound to Logback ({}), leaving levels untouched.", factory.getClass().getName());
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
        loggingConfigured = true;
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final String levelStr = loggingConfig.getString(DEFAULT_LEVEL_KEY);
            final Level level = Level.toLevel(levelStr, Level.WARN);

            final Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(level);

            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }

        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;

        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'.", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }

        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the logging configuration state. This is primarily useful for testing.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
