package me.bechberger.plumbr;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets log levels from the command line verbosity flags.
 * Must run before the first command logs anything.
 */
public class LoggingConfig {

    static final String APP_LOGGER_NAME = "me.bechberger.plumbr";

    /**
     * Configure the root and application logger levels. Debug wins over verbose,
     * verbose over quiet; with no flag the levels from logback.xml stay in place.
     */
    public static void configure(boolean debug, boolean verbose, boolean quiet) {
        if (debug) {
            setLevel(Level.DEBUG);
        } else if (verbose) {
            setLevel(Level.INFO);
        } else if (quiet) {
            setLevel(Level.ERROR);
        }
    }

    /**
     * Set the level of the root and the application logger.
     */
    public static void setLevel(Level level) {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(level);
        ((Logger) LoggerFactory.getLogger(APP_LOGGER_NAME)).setLevel(level);
    }

    public static Level getLevel() {
        return ((Logger) LoggerFactory.getLogger(APP_LOGGER_NAME)).getEffectiveLevel();
    }
}
