package ph.extremelogic.common.treelog.layout;

import ph.extremelogic.common.treelog.LogRecord;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for layouts that project the record's field set into a structured syntax.
 * Every subclass renders the same fields in the same order.
 */
public abstract class StructuredLayout implements Layout {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final ZoneId SYSTEM_ZONE = ZoneId.systemDefault();

    @Override
    public final String toSerializable(LogRecord record) {
        return render(fields(record));
    }

    protected abstract String render(Map<String, Object> fields);

    /**
     * Field projection: {@code time, name, prefix, parent, level, level_value, message,
     * thread, category, tags, extra}. {@code tags} is a list of strings and {@code extra}
     * a map. Extra values that are not strings, numbers or booleans are rendered with
     * {@code toString()}.
     */
    public static Map<String, Object> fields(LogRecord record) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("time", OffsetDateTime.ofInstant(record.getCreatedAt(), SYSTEM_ZONE).format(ISO));
        fields.put("name", record.getLoggerName());
        fields.put("prefix", record.getPrefix());
        fields.put("parent", record.getParentName());
        fields.put("level", record.getLevel().getName());
        fields.put("level_value", record.getLevel().getIntLevel());
        fields.put("message", record.getMessage());
        fields.put("thread", record.getThreadName());
        fields.put("category", record.getCategory());
        fields.put("tags", record.getTags());

        Map<String, Object> extra = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : record.getExtra().entrySet()) {
            extra.put(entry.getKey(), simpleValue(entry.getValue()));
        }
        fields.put("extra", extra);
        return fields;
    }

    private static Object simpleValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }

    /**
     * Plain text of a scalar field; list elements are joined with {@code ", "}.
     */
    protected static String text(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection) {
            StringBuilder sb = new StringBuilder();
            for (Object item : (Collection<?>) value) {
                if (sb.length() > 0) sb.append(", ");
                sb.append(item);
            }
            return sb.toString();
        }
        return value.toString();
    }
}
