package org.kwindex.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} configuration block to Logback:
 * <pre>
 * logging {
 *   format = "COLOR"                       # or PLAIN
 *   levels {
 *     "org.kwindex.runtime.index" = DEBUG
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    static final String APPENDER_PROPERTY = "kwindex.logging.appender";

    private LoggingConfigurator() {
    }

    /**
     * Selects the console appender and sets the level of every logger named in
     * {@code logging.levels}.
     *
     * @param config The resolved configuration.
     * @throws IllegalArgumentException If the format or a level name is invalid.
     */
    public static void configure(Config config) {
        if (config.hasPath("logging.format")) {
            selectAppender(config.getString("logging.format"));
        }
        if (!config.hasPath("logging.levels")) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
            String loggerName = entry.getKey();
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                throw new IllegalArgumentException("Invalid log level '" + levelName + "' for logger " + loggerName);
            }
            ((Logger) LoggerFactory.getLogger(loggerName)).setLevel(level);
        }
    }

    private static void selectAppender(String format) {
        String appender;
        if ("PLAIN".equalsIgnoreCase(format)) {
            appender = "STDOUT_PLAIN";
        } else if ("COLOR".equalsIgnoreCase(format)) {
            appender = "STDOUT";
        } else {
            throw new IllegalArgumentException("Invalid logging.format '" + format + "', expected PLAIN or COLOR");
        }
        if (appender.equals(System.getProperty(APPENDER_PROPERTY, "STDOUT_PLAIN"))) {
            return;
        }
        System.setProperty(APPENDER_PROPERTY, appender);
        reconfigureLogback();
    }

    private static void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            throw new IllegalStateException("Failed to reconfigure Logback from " + configUrl, e);
        }
    }
}
