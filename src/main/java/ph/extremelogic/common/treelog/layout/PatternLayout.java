package ph.extremelogic.common.treelog.layout;

import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.LogRecord;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Template layout with {@code {token}} placeholders.
 *
 * <p>Reserved tokens: {@code time}, {@code date}, {@code name}, {@code prefix},
 * {@code parent}, {@code level_name}, {@code level_value}, {@code message},
 * {@code thread}, {@code category}, {@code tags}, {@code elapsed} and {@code extra}.
 * {@code tags} renders as {@code [a, b]}. Any other token is looked up in the
 * record's extras; tokens that resolve to nothing are written back verbatim. A reserved
 * token always wins over an extra with the same key.</p>
 */
public final class PatternLayout implements Layout {
    public static final String DEFAULT_PATTERN = "[{time}] {prefix} | {level_name}[{level_value}]: {message}";
    public static final String DEFAULT_TIME_PATTERN = "dd/MM/yyyy HH:mm:ss";

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final ThreadLocal<StringBuilder> BUFFER_POOL =
            ThreadLocal.withInitial(() -> new StringBuilder(256));

    private final String pattern;
    private final DateTimeFormatter timeFormatter;
    private final ZoneId zone;
    private final long startMillis = System.currentTimeMillis();
    // Even indexes are literals, odd indexes are token names
    private final String[] segments;

    public PatternLayout() {
        this(DEFAULT_PATTERN, DEFAULT_TIME_PATTERN);
    }

    public PatternLayout(String pattern) {
        this(pattern, DEFAULT_TIME_PATTERN);
    }

    public PatternLayout(String pattern, String timePattern) {
        this(pattern, timePattern, ZoneId.systemDefault());
    }

    public PatternLayout(String pattern, String timePattern, ZoneId zone) {
        this.pattern = pattern != null ? pattern : DEFAULT_PATTERN;
        try {
            this.timeFormatter = DateTimeFormatter.ofPattern(
                    timePattern != null ? timePattern : DEFAULT_TIME_PATTERN);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid time pattern: " + timePattern, e);
        }
        this.zone = zone;
        this.segments = parse(this.pattern);
    }

    private static String[] parse(String pattern) {
        List<String> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '{') {
                int close = pattern.indexOf('}', i + 1);
                if (close > i + 1) {
                    parts.add(literal.toString());
                    literal.setLength(0);
                    parts.add(pattern.substring(i + 1, close));
                    i = close + 1;
                    continue;
                }
            }
            literal.append(c);
            i++;
        }
        parts.add(literal.toString());
        return parts.toArray(new String[0]);
    }

    @Override
    public String toSerializable(LogRecord record) {
        StringBuilder sb = BUFFER_POOL.get();
        sb.setLength(0);

        LocalDateTime dateTime = null;
        for (int i = 0; i < segments.length; i++) {
            if ((i & 1) == 0) {
                sb.append(segments[i]);
                continue;
            }
            String token = segments[i];
            if ((token.equals("time") || token.equals("date")) && dateTime == null) {
                dateTime = LocalDateTime.ofInstant(record.getCreatedAt(), zone);
            }
            appendToken(sb, token, record, dateTime);
        }
        return sb.toString();
    }

    private void appendToken(StringBuilder sb, String token, LogRecord record, LocalDateTime dateTime) {
        switch (token) {
            case "time":
                sb.append(dateTime.format(timeFormatter));
                return;
            case "date":
                sb.append(dateTime.format(DATE_FORMATTER));
                return;
            case "name":
                sb.append(record.getLoggerName());
                return;
            case "prefix":
                sb.append(record.getPrefix() != null ? record.getPrefix() : record.getLoggerName());
                return;
            case "parent":
                sb.append(record.getParentName() != null ? record.getParentName() : "");
                return;
            case "level_name":
                sb.append(record.getLevel().getName());
                return;
            case "level_value":
                sb.append(record.getLevel().getIntLevel());
                return;
            case "message":
                sb.append(record.getMessage());
                return;
            case "thread":
                sb.append(record.getThreadName());
                return;
            case "category":
                sb.append(record.getCategory() != null ? record.getCategory() : "");
                return;
            case "tags":
                sb.append(record.getTags());
                return;
            case "elapsed":
                long elapsed = record.getCreatedAt().toEpochMilli() - startMillis;
                sb.append(String.format(Locale.ROOT, "%.3f", Math.max(0L, elapsed) / 1000.0));
                return;
            case "extra":
                appendExtra(sb, record.getExtra());
                return;
            default:
                Map<String, Object> extra = record.getExtra();
                if (extra.containsKey(token)) {
                    sb.append(extra.get(token));
                } else {
                    sb.append('{').append(token).append('}');
                }
        }
    }

    private static void appendExtra(StringBuilder sb, Map<String, Object> extra) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, Object> entry : extra.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        sb.append('}');
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String getContentType() {
        return "text/plain";
    }
}
