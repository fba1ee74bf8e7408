package org.energysaving.cli.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies the log levels of {@code energysaving.logging} to Logback.
 * <p>
 * {@code default} sets the root level, {@code levels} maps logger names to levels:
 * <pre>
 * energysaving.logging {
 *   default = INFO
 *   levels { "org.energysaving.datapipeline.query" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private static final String LOGGING_PATH = "energysaving.logging";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath(LOGGING_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            log.warn("Logging backend is not Logback, ignoring {}", LOGGING_PATH);
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Config logging = config.getConfig(LOGGING_PATH);
        if (logging.hasPath("default")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(logging.getString("default"), Level.INFO));
        }
        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                String loggerName = entry.getKey().replace("\"", "");
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
                log.debug("Log level of {} set to {}", loggerName, level);
            }
        }
    }
}
