package org.kestrel.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback and {@link CompilerLogger}.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"       # root logger
 *   compiler-verbosity = 2       # CompilerLogger, 0=ERROR .. 4=TRACE
 *   levels {
 *     "org.kestrel.compiler.frontend.semantics" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * Only the first call has an effect until {@link #reset()}.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    private static final String ROOT_PATH = "logging";
    private static final String DEFAULT_LEVEL = "default-level";
    private static final String VERBOSITY = "compiler-verbosity";
    private static final String LEVELS = "levels";

    private static boolean configured;

    private LoggingConfigurator() {}

    /**
     * @param config The resolved application configuration; a missing {@code logging} block keeps the
     *               Logback defaults.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            return;
        }
        configured = true;
        if (!config.hasPath(ROOT_PATH)) {
            LOGGER.debug("no logging block, keeping Logback defaults");
            return;
        }

        final Config logging = config.getConfig(ROOT_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath(DEFAULT_LEVEL)) {
            final Level root = Level.toLevel(logging.getString(DEFAULT_LEVEL), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(root);
        }
        for (Map.Entry<String, Level> entry : loggerLevels(logging).entrySet()) {
            context.getLogger(entry.getKey()).setLevel(entry.getValue());
        }
        if (logging.hasPath(VERBOSITY)) {
            CompilerLogger.setLevel(logging.getInt(VERBOSITY));
        }
    }

    private static Map<String, Level> loggerLevels(final Config logging) {
        final Map<String, Level> levels = new LinkedHashMap<>();
        if (!logging.hasPath(LEVELS)) {
            return levels;
        }
        logging.getConfig(LEVELS).root().forEach((name, value) -> {
            final String text = String.valueOf(value.unwrapped());
            final Level level = Level.toLevel(text, null);
            if (level == null) {
                LOGGER.warn("ignoring unknown level '{}' for logger '{}'", text, name);
            } else {
                levels.put(name, level);
            }
        });
        return levels;
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply its settings again.
     */
    public static synchronized void reset() {
        configured = false;
    }
}
