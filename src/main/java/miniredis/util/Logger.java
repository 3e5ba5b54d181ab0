package miniredis.util;

import java.util.Locale;

public abstract class Logger {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private static volatile Level threshold = Level.INFO;

    public static void setLevel(Level level) {
        threshold = level;
    }

    public static Level parseLevel(String name) {
        return Level.valueOf(name.toUpperCase(Locale.ROOT));
    }

    public static boolean isEnabled(Level level) {
        return level.compareTo(threshold) >= 0;
    }

    public static void debug(String message, Object... args) {
        log(Level.DEBUG, message, args);
    }

    public static void info(String message, Object... args) {
        log(Level.INFO, message, args);
    }

    public static void warn(String message, Object... args) {
        log(Level.WARN, message, args);
    }

    public static void error(String message, Object... args) {
        log(Level.ERROR, message, args);
    }

    private static void log(Level level, String message, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        if (args.length > 0) {
            message = String.format(message, args);
        }
        System.err.println(level + ": " + message);
    }
}
