package org.psyforge.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler-wide logging facade with an integer verbosity on top of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
 * Messages use SLF4J placeholders ({@code {}}).
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN = 1;
    /** Log level for informational messages. */
    public static final int INFO = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;

    private static volatile int level = INFO;

    private static final Logger LOG = LoggerFactory.getLogger("org.psyforge.compiler");

    private CompilerLogger() {}

    /**
     * Sets the verbosity, clamped to [ERROR, TRACE].
     * @param newLevel The new level.
     */
    public static void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    /**
     * @return the current verbosity.
     */
    public static int getLevel() {
        return level;
    }

    /**
     * @param candidate A verbosity level.
     * @return true if messages at that level are currently emitted.
     */
    public static boolean isEnabled(int candidate) {
        return level >= candidate;
    }

    public static void error(String format, Object... args) {
        if (isEnabled(ERROR)) LOG.error(format, args);
    }

    public static void warn(String format, Object... args) {
        if (isEnabled(WARN)) LOG.warn(format, args);
    }

    public static void info(String format, Object... args) {
        if (isEnabled(INFO)) LOG.info(format, args);
    }

    public static void debug(String format, Object... args) {
        if (isEnabled(DEBUG)) LOG.debug(format, args);
    }

    public static void trace(String format, Object... args) {
        if (isEnabled(TRACE)) LOG.trace(format, args);
    }
}
