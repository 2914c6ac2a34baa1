package arbor.core.util;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * A simple logging utility that can be either enabled or disabled globally.
 *
 * Every logger shares a single global verbosity. Warnings are always written (to stderr) while loggers are enabled,
 * regular messages require a verbosity of at least {@link Logger#INFO} and debug messages a verbosity of at least
 * {@link Logger#DEBUG}.
 */
public final class Logger {
    public static final int WARN = 0;
    public static final int INFO = 1;
    public static final int DEBUG = 2;
    private static volatile boolean globalEnabled = true;
    private static volatile int globalVerbosity = INFO;
    private final String className;
    private boolean enabled = true;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logging for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    /**
     * Sets the verbosity shared by all loggers. Negative values are treated as zero.
     *
     * @param verbosity The new verbosity.
     */
    public static void setVerbosity(int verbosity) {
        globalVerbosity = Math.max(WARN, verbosity);
    }

    /**
     * Returns the verbosity shared by all loggers.
     *
     * @return the global verbosity.
     */
    public static int getVerbosity() {
        return globalVerbosity;
    }

    /**
     * Disables this logger only.
     */
    public void disable() {
        this.enabled = false;
    }

    /**
     * Enables this logger only.
     */
    public void enable() {
        this.enabled = true;
    }

    /**
     * Logs the specified message to stdout if logging is enabled and the verbosity is at least {@link Logger#INFO}.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (isEnabledAt(INFO)) {
            System.out.println(this.className + ": " + message);
        }
    }

    /**
     * Logs the specified message to stdout if logging is enabled and the verbosity is at least {@link Logger#DEBUG}.
     *
     * @param message The message to log.
     */
    public void debug(String message) {
        if (isEnabledAt(DEBUG)) {
            System.out.println(this.className + ": [debug] " + message);
        }
    }

    /**
     * Logs the specified message followed by the stack trace of the given throwable at debug level.
     *
     * @param message The message to log.
     * @param throwable The throwable whose stack trace is logged.
     */
    public void debug(String message, Throwable throwable) {
        if (isEnabledAt(DEBUG)) {
            System.out.println(this.className + ": [debug] " + message + "\n" + stackTraceOf(throwable));
        }
    }

    /**
     * Logs the specified message to stderr if logging is enabled.
     *
     * @param message The message to log.
     */
    public void warn(String message) {
        if (isEnabledAt(WARN)) {
            System.err.println(this.className + ": [warn] " + message);
        }
    }

    /**
     * Returns true iff a message at the given level would currently be written by this logger.
     *
     * @param level The level to check.
     * @return whether or not the level is enabled.
     */
    public boolean isEnabledAt(int level) {
        return globalEnabled && this.enabled && globalVerbosity >= level;
    }

    private static String stackTraceOf(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled (global): " + globalEnabled + ", enabled (local): " + this.enabled + ", verbosity: " + globalVerbosity + " }";
    }
}
