package org.kestrel.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verbosity-gated logging facade for the analysis core.
 * <p>
 * Verbosity runs from {@link #ERROR} (0) to {@link #TRACE} (4). A call above the current verbosity is
 * dropped before SLF4J sees it; whatever passes is filtered again by the Logback configuration.
 * Messages may use SLF4J {@code {}} placeholders.
 */
public final class CompilerLogger {

    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;

    private static final Logger LOG = LoggerFactory.getLogger(CompilerLogger.class);

    private static volatile int verbosity = INFO;

    private CompilerLogger() {}

    /**
     * Sets the verbosity, clamped to {@code [ERROR, TRACE]}.
     */
    public static void setLevel(int newLevel) {
        verbosity = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    public static int getLevel() {
        return verbosity;
    }

    public static void error(String msg, Object... args) {
        LOG.error(msg, args);
    }

    public static void warn(String msg, Object... args) {
        if (verbosity >= WARN) {
            LOG.warn(msg, args);
        }
    }

    public static void info(String msg, Object... args) {
        if (verbosity >= INFO) {
            LOG.info(msg, args);
        }
    }

    public static void debug(String msg, Object... args) {
        if (verbosity >= DEBUG) {
            LOG.debug(msg, args);
        }
    }

    public static void trace(String msg, Object... args) {
        if (verbosity >= TRACE) {
            LOG.trace(msg, args);
        }
    }

    /**
     * @return {@code true} if a trace message would reach the log, so callers can skip rendering
     *         instruction dumps.
     */
    public static boolean isTraceEnabled() {
        return verbosity >= TRACE && LOG.isTraceEnabled();
    }
}
