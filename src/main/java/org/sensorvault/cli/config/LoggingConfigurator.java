package org.sensorvault.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.sensorvault.storage.file" = "DEBUG"
 *     "com.zaxxer.hikari" = "WARN"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (config.hasPath("logging.default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            // entrySet flattens dotted keys; quoted logger names come back as a single path element
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").entrySet()) {
                String loggerName = entry.getKey().replace("\"", "");
                Logger logger = context.getLogger(loggerName);
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }
}
