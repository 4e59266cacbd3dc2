package mnemo.utils;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Mnemo");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";
                String line = String.format("[%s] %s%n", levelStr, record.getMessage());
                if (record.getThrown() != null) {
                    line += record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        });
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    /**
     * Sets the threshold from a config name: DEBUG, INFO, WARN or ERROR.
     * Anything else falls back to INFO.
     */
    public static void setLevel(String name) {
        logger.setLevel(toLevel(name));
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    static Level toLevel(String name) {
        if (name == null) return Level.INFO;
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG": return Level.FINE;
            case "WARN":
            case "WARNING": return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default: return Level.INFO;
        }
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable t) {
        logger.log(Level.SEVERE, msg, t);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
