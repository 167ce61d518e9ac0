package kvd.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("kvd");

    static {
        logger.setUseParentHandlers(false);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.ALL);
        handler.setFormatter(new LineFormatter());
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    static class LineFormatter extends SimpleFormatter {
        @Override
        public synchronized String format(LogRecord record) {
            String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                              record.getLevel() == Level.WARNING ? "WARN" :
                              record.getLevel() == Level.INFO ? "INFO" : "DEBUG";
            String line = String.format("[%s] [%s] %s%n", levelStr, Thread.currentThread().getName(), record.getMessage());
            if (record.getThrown() != null) {
                StringWriter sw = new StringWriter();
                try (PrintWriter pw = new PrintWriter(sw)) {
                    record.getThrown().printStackTrace(pw);
                }
                line += sw;
            }
            return line;
        }
    }

    public static void setDebug(boolean debug) {
        logger.setLevel(debug ? Level.FINE : Level.INFO);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
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

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
