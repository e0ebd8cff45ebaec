package ph.extremelogic.common.treelog.api;

import ph.extremelogic.common.treelog.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Severity of a log record. Levels are totally ordered by {@link #intLevel} and can be
 * compared against other levels or raw integers. Besides the built-in constants, new
 * named levels may be registered at runtime with {@link #register(String, int, AnsiColor)}.
 */
public final class Level implements Comparable<Level> {
    private static final Map<String, Level> BY_NAME = new ConcurrentHashMap<>();
    private static final Map<Integer, Level> BY_VALUE = new ConcurrentHashMap<>();

    public static final Level NOTSET = builtIn("NOTSET", 0, AnsiColor.WHITE);
    public static final Level TRACE = builtIn("TRACE", 10, AnsiColor.LIGHT_BLUE);
    public static final Level DEBUG = builtIn("DEBUG", 20, AnsiColor.LIGHT_CYAN);
    public static final Level INFO = builtIn("INFO", 30, AnsiColor.LIGHT_GREEN);
    public static final Level SUCCESS = builtIn("SUCCESS", 40, AnsiColor.GREEN);
    public static final Level WARNING = builtIn("WARNING", 50, AnsiColor.LIGHT_YELLOW);
    public static final Level FAIL = builtIn("FAIL", 60, AnsiColor.RED);
    public static final Level ERROR = builtIn("ERROR", 70, AnsiColor.LIGHT_RED);
    public static final Level CRITICAL = builtIn("CRITICAL", 80, AnsiColor.LIGHT_MAGENTA);

    // Aliases share the instance of their canonical level
    public static final Level NOTICE = alias("NOTICE", SUCCESS);
    public static final Level WARN = alias("WARN", WARNING);
    public static final Level FATAL = alias("FATAL", CRITICAL);

    public final int intLevel;
    private final String name;
    private final AnsiColor color;

    private Level(String name, int intLevel, AnsiColor color) {
        this.name = name;
        this.intLevel = intLevel;
        this.color = color;
    }

    private static Level builtIn(String name, int value, AnsiColor color) {
        Level level = new Level(name, value, color);
        BY_NAME.put(name, level);
        BY_VALUE.put(value, level);
        return level;
    }

    private static Level alias(String name, Level target) {
        BY_NAME.put(name, target);
        return target;
    }

    /**
     * Registers a new named level.
     *
     * @throws ConfigurationException if the name is blank or already taken by a level or alias
     */
    public static Level register(String name, int value, AnsiColor color) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Level name must not be blank");
        }
        String key = name.trim().toUpperCase(Locale.ROOT);
        Level level = new Level(key, value, color != null ? color : AnsiColor.WHITE);
        if (BY_NAME.putIfAbsent(key, level) != null) {
            throw new ConfigurationException("Level '" + key + "' is already registered");
        }
        BY_VALUE.putIfAbsent(value, level);
        return level;
    }

    /**
     * Resolves a level or alias name, ignoring case. Returns {@code null} when unknown.
     */
    public static Level forName(String name) {
        if (name == null) return null;
        return BY_NAME.get(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the registered level with the given value, or an unnamed level carrying
     * that value and the default color.
     */
    public static Level forValue(int value) {
        Level level = BY_VALUE.get(value);
        return level != null ? level : new Level("LEVEL" + value, value, AnsiColor.WHITE);
    }

    /**
     * Canonical registered levels (aliases excluded), ordered by value.
     */
    public static List<Level> values() {
        List<Level> levels = new ArrayList<>();
        for (Map.Entry<String, Level> entry : BY_NAME.entrySet()) {
            if (entry.getKey().equals(entry.getValue().name)) {
                levels.add(entry.getValue());
            }
        }
        levels.sort(Comparator.comparingInt(Level::getIntLevel));
        return Collections.unmodifiableList(levels);
    }

    public int getIntLevel() {
        return intLevel;
    }

    public String getName() {
        return name;
    }

    /**
     * Display color; levels registered without one fall back to white.
     */
    public AnsiColor color() {
        return color != null ? color : AnsiColor.WHITE;
    }

    public boolean isAtLeast(Level other) {
        return intLevel >= other.intLevel;
    }

    public boolean isAtLeast(int value) {
        return intLevel >= value;
    }

    public boolean isAtMost(Level other) {
        return intLevel <= other.intLevel;
    }

    public boolean isAtMost(int value) {
        return intLevel <= value;
    }

    public boolean isAbove(Level other) {
        return intLevel > other.intLevel;
    }

    public boolean isAbove(int value) {
        return intLevel > value;
    }

    public boolean isBelow(Level other) {
        return intLevel < other.intLevel;
    }

    public boolean isBelow(int value) {
        return intLevel < value;
    }

    @Override
    public int compareTo(Level other) {
        return Integer.compare(intLevel, other.intLevel);
    }

    public int compareTo(int value) {
        return Integer.compare(intLevel, value);
    }

    /**
     * Levels are equal when their values are equal, so a registered level and an
     * anonymous level with the same value compare the same.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Level)) return false;
        return intLevel == ((Level) o).intLevel;
    }

    public boolean equals(int value) {
        return intLevel == value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(intLevel);
    }

    @Override
    public String toString() {
        return name;
    }
}
