package ph.extremelogic.common.treelog.message;

/**
 * SLF4J-style {@code {}} placeholder substitution for the level shortcut methods.
 */
public final class ParameterizedMessage {
    private static final String PLACEHOLDER = "{}";

    private ParameterizedMessage() {
    }

    public static String format(String format, Object... args) {
        if (format == null) {
            return null;
        }
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder buffer = new StringBuilder(format.length() + 16 * args.length);
        int start = 0;
        int paramIndex = 0;
        final int formatLength = format.length();

        while (paramIndex < args.length) {
            int placeholderIndex = format.indexOf(PLACEHOLDER, start);
            if (placeholderIndex == -1) break;

            buffer.append(format, start, placeholderIndex);
            Object param = args[paramIndex++];
            buffer.append(param != null ? param.toString() : "null");
            start = placeholderIndex + 2;
        }

        if (start < formatLength) {
            buffer.append(format, start, formatLength);
        }

        // Leftover arguments are appended rather than silently dropped
        if (paramIndex < args.length) {
            buffer.append(" [");
            for (; paramIndex < args.length; paramIndex++) {
                buffer.append(args[paramIndex]);
                if (paramIndex < args.length - 1) {
                    buffer.append(", ");
                }
            }
            buffer.append(']');
        }
        return buffer.toString();
    }
}
