package ph.extremelogic.common.treelog.middleware;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds a fixed set of context values to each record's extras. Keys the record already
 * carries keep their value. With interpolation on, {@code {key}} placeholders in the
 * message are replaced from the merged extras.
 */
public class ContextMiddleware extends AbstractMiddleware {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.\\-]+)}");

    private final Map<String, Object> context;
    private final boolean interpolate;

    public ContextMiddleware(Map<String, ?> context) {
        this(context, false, 0);
    }

    public ContextMiddleware(Map<String, ?> context, boolean interpolate, int priority) {
        super(priority);
        this.context = new LinkedHashMap<>(context);
        this.interpolate = interpolate;
    }

    @Override
    protected LogRecord process(Logger logger, LogRecord record) {
        Map<String, Object> missing = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : context.entrySet()) {
            if (!record.getExtra().containsKey(entry.getKey())) {
                missing.put(entry.getKey(), entry.getValue());
            }
        }
        LogRecord merged = record.withExtras(missing);
        if (!interpolate || merged.getMessage().indexOf('{') < 0) {
            return merged;
        }
        return merged.withMessage(interpolate(merged.getMessage(), merged.getExtra()));
    }

    static String interpolate(String message, Map<String, Object> values) {
        Matcher m = PLACEHOLDER.matcher(message);
        StringBuilder sb = new StringBuilder(message.length() + 16);
        while (m.find()) {
            String key = m.group(1);
            String replacement = values.containsKey(key) ? String.valueOf(values.get(key)) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public Map<String, Object> getContext() {
        return new LinkedHashMap<>(context);
    }
}
