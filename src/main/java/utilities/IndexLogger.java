package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class IndexLogger {
    // Setting this system property to a path adds an append-mode file handler.
    public static final String LOG_FILE_PROPERTY = "stindex.log.file";

    private static final Logger logger = Logger.getLogger(IndexLogger.class.getName());

    static {
        logger.setUseParentHandlers(false); // Disable default console handler

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);

        // FINE and below only reach the optional file handler
        logger.setLevel(Level.INFO);

        String logFile = System.getProperty(LOG_FILE_PROPERTY);
        if (logFile != null && !logFile.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true);
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
                logger.setLevel(Level.ALL);
            } catch (Exception e) {
                logger.warning("Failed to open log file " + logFile + ": " + e.getMessage());
            }
        }
    }

    private IndexLogger() {
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }
}
