package io.pulse.logging;

import java.util.Locale;
import java.util.logging.Level;

/**
 * Output levels understood by {@link LoggerRegistry}, with their {@code java.util.logging}
 * equivalents.
 */
public enum LogLevel {
    DEBUG(Level.FINE),
    INFO(Level.INFO),
    WARN(Level.WARNING),
    ERROR(Level.SEVERE),
    FATAL(Level.SEVERE),
    /**
     * Unrecognized level name. Loggers set to it inherit their parent's level.
     */
    UNDEFINED(null);

    private final Level julLevel;

    LogLevel(Level julLevel) {
        this.julLevel = julLevel;
    }

    /**
     * Returns the {@code java.util.logging} level, or {@code null} for {@link #UNDEFINED}.
     *
     * @return the JUL level
     */
    public Level julLevel() {
        return julLevel;
    }

    /**
     * Resolves a level name such as {@code "warn"}, ignoring case.
     *
     * @param name the level name
     * @return the level, or {@link #UNDEFINED} if the name is unknown or {@code null}
     */
    public static LogLevel of(String name) {
        if (name == null) {
            return UNDEFINED;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "debug":
                return DEBUG;
            case "info":
                return INFO;
            case "warn":
                return WARN;
            case "error":
                return ERROR;
            case "fatal":
                return FATAL;
            default:
                return UNDEFINED;
        }
    }
}
