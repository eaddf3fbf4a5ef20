package com.gdformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.*;

/**
 * Configures java.util.logging for the formatter and hands out loggers.
 * The bundled {@code /logging.properties} wins; without it a console
 * handler and an appending file handler are installed.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String PROJECT_LOGGER = "com.gdformatter";
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;
    private static final Path LOG_FILE = Paths.get("gdformatter.log");

    /**
     * Reads {@code /logging.properties}, or installs the fallback handlers when it is missing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
    }

    /**
     * Console handler at the current console level plus an appending {@code gdformatter.log}.
     */
    private static void configureBasicLogging() throws IOException {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        FileHandler fileHandler = new FileHandler(LOG_FILE.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.addHandler(fileHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the level of every console handler; {@code --verbose} lowers it to FINE.
     */
    public static void setConsoleLevel(Level level) {
        consoleLevel = level;

        if (initialized) {
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(level);
                }
            }
            Logger projectLogger = Logger.getLogger(PROJECT_LOGGER);
            if (projectLogger.getLevel() != null && projectLogger.getLevel().intValue() > level.intValue()) {
                projectLogger.setLevel(level);
            }
        }
    }

    /**
     * Logger named after the class, initializing logging on first use.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Closes every root handler so the log file is flushed before exit.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
