package org.tilecascade.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.tilecascade.runtime.Round" = "INFO"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private LoggingConfigurator() {
    }

    /**
     * Configures Logback from the {@code logging} block of the configuration.
     * Does nothing if the block is missing or SLF4J is not bound to Logback.
     *
     * @param config The application configuration.
     * @return The number of loggers whose level was set, the root logger included.
     */
    public static int configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return 0;
        }
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            LOGGER.debug("SLF4J is not bound to Logback, skipping logging configuration.");
            return 0;
        }
        final LoggerContext context = (LoggerContext) factory;
        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        return configureDefaultLevel(loggingConfig, context) + configureSpecificLevels(loggingConfig, context);
    }

    private static int configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            return 0;
        }
        final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        LOGGER.debug("Configured default log level: {}", level);
        return 1;
    }

    private static int configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return 0;
        }
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
        return configuredCount;
    }
}
