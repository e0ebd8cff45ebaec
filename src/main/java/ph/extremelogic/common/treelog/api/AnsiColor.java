package ph.extremelogic.common.treelog.api;

import java.util.Locale;

/**
 * Terminal colors used to decorate console output.
 */
public enum AnsiColor {
    BLACK("\u001B[30m"),
    RED("\u001B[31m"),
    GREEN("\u001B[32m"),
    YELLOW("\u001B[33m"),
    BLUE("\u001B[34m"),
    MAGENTA("\u001B[35m"),
    CYAN("\u001B[36m"),
    WHITE("\u001B[37m"),
    LIGHT_RED("\u001B[91m"),
    LIGHT_GREEN("\u001B[92m"),
    LIGHT_YELLOW("\u001B[93m"),
    LIGHT_BLUE("\u001B[94m"),
    LIGHT_MAGENTA("\u001B[95m"),
    LIGHT_CYAN("\u001B[96m");

    public static final String RESET = "\u001B[0m";

    private final String prefix;

    AnsiColor(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String wrap(String text) {
        return prefix + text + RESET;
    }

    public static AnsiColor forName(String name) {
        if (name == null) return null;
        try {
            return AnsiColor.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
