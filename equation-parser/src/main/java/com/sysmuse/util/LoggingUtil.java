package com.sysmuse.util;

import com.sysmuse.equation.EquationConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.*;

/**
 * Centralized logging for the equation parser.
 * Thin static facade over java.util.logging, configured from the
 * "logging" section of {@link EquationConfig}.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    public static final String LOGGER_NAME = "com.sysmuse.equation";

    private static final Logger logger = Logger.getLogger(LOGGER_NAME);
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean fileLogging = false;
    private static String logFileName = EquationConfig.DEFAULT_LOG_FILE;
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    private static class StreamConsoleHandler extends StreamHandler {
        StreamConsoleHandler(PrintStream stream, Level level) {
            super(stream, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Configure where log messages go in console. Takes effect on the next initialization.
     */
    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * (Re)configure the logging system from parser configuration, replacing
     * whatever handlers an earlier initialization installed.
     */
    public static synchronized void configure(EquationConfig config) {
        reset();
        setConsoleOutputMode(config.getConsoleOutputMode());
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    /**
     * Initialize the logging system. Only the first initialization wins unless
     * {@link #reset()} is called.
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled,
                                               boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = toLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        fileLogging = false;
        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                // logger is still usable through the console handlers
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    /**
     * Drop all handlers and restore the default console mode so the next call re-initializes.
     */
    public static synchronized void reset() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            // closing a console handler would close System.out/err
            if (handler instanceof FileHandler) {
                handler.close();
            } else {
                handler.flush();
            }
        }
        consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;
        initialized = false;
    }

    static Level toLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            case "OFF": return Level.OFF;
            default: return Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new StreamConsoleHandler(System.out, currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new StreamConsoleHandler(System.err, currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                StreamConsoleHandler out = new StreamConsoleHandler(System.out, currentLevel);
                out.setFilter(record -> record.getLevel().intValue() < Level.SEVERE.intValue());
                logger.addHandler(out);
                logger.addHandler(new StreamConsoleHandler(System.err, Level.SEVERE));
                break;
        }
    }

    /**
     * The underlying logger, for attaching extra handlers.
     */
    public static Logger getLogger() {
        ensureInitialized();
        return logger;
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, EquationConfig.DEFAULT_LOG_FILE);
        }
    }
}
