package ph.extremelogic.common.treelog;

import java.io.PrintStream;

/**
 * Last-resort diagnostics for the library itself. Writes to the current
 * {@code System.err} so that a broken appender can never recurse into logging.
 */
public final class StatusLogger {
    private static final String PREFIX = "treelog ";

    private StatusLogger() {
    }

    public static void warn(String message) {
        print("WARN", message, null);
    }

    public static void warn(String message, Throwable cause) {
        print("WARN", message, cause);
    }

    public static void error(String message) {
        print("ERROR", message, null);
    }

    public static void error(String message, Throwable cause) {
        print("ERROR", message, cause);
    }

    private static void print(String level, String message, Throwable cause) {
        PrintStream err = System.err;
        synchronized (err) {
            err.println(PREFIX + level + ": " + message);
            if (cause != null) {
                cause.printStackTrace(err);
            }
        }
    }
}
