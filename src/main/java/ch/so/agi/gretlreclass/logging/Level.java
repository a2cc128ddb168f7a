package ch.so.agi.gretlreclass.logging;

import java.util.Locale;

/**
 * Semantic log levels of the engine and their {@link java.util.logging.Level}
 * counterparts. {@code LIFECYCLE} sits between warnings and informational
 * messages, so a backend configured for {@code LIFECYCLE} shows start/finish
 * announcements, warnings and errors only.
 */
public class Level {

    public static final Level ERROR = new Level("ERROR", java.util.logging.Level.SEVERE);
    public static final Level WARN = new Level("WARN", java.util.logging.Level.WARNING);
    public static final Level LIFECYCLE = new Level("LIFECYCLE", java.util.logging.Level.CONFIG);
    public static final Level INFO = new Level("INFO", java.util.logging.Level.FINE);
    public static final Level DEBUG = new Level("DEBUG", java.util.logging.Level.FINER);

    private final String name;
    private final java.util.logging.Level innerLevel;

    private Level(String name, java.util.logging.Level innerLevel) {
        this.name = name;
        this.innerLevel = innerLevel;
    }

    /**
     * Resolves a level by its name, ignoring case.
     *
     * @param name one of ERROR, WARN, LIFECYCLE, INFO, DEBUG
     * @return the matching level
     * @throws IllegalArgumentException for unknown names
     */
    public static Level parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("level name must not be null");
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
        case "ERROR":
            return ERROR;
        case "WARN":
            return WARN;
        case "LIFECYCLE":
            return LIFECYCLE;
        case "INFO":
            return INFO;
        case "DEBUG":
            return DEBUG;
        default:
            throw new IllegalArgumentException("Unknown log level: " + name);
        }
    }

    java.util.logging.Level getInnerLevel() {
        return innerLevel;
    }

    @Override
    public String toString() {
        return name;
    }
}
