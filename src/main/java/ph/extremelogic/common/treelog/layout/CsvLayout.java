package ph.extremelogic.common.treelog.layout;

import java.util.List;
import java.util.Map;

/**
 * One CSV row per record, quoted per RFC 4180. Tags are written as a single
 * {@code a;b} column and extras as a single {@code k=v;k=v} column.
 */
public final class CsvLayout extends StructuredLayout {
    public static final String HEADER = "time,name,prefix,parent,level,level_value,message,thread,category,tags,extra";

    @Override
    protected String render(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder(256);
        boolean first = true;
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            if (!first) sb.append(',');
            first = false;
            Object value = field.getValue();
            if (value instanceof Map) {
                StringBuilder extra = new StringBuilder();
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    if (extra.length() > 0) extra.append(';');
                    extra.append(String.valueOf(entry.getKey())).append('=').append(text(entry.getValue()));
                }
                sb.append(quote(extra.toString()));
            } else if (value instanceof List) {
                StringBuilder tags = new StringBuilder();
                for (Object tag : (List<?>) value) {
                    if (tags.length() > 0) tags.append(';');
                    tags.append(tag);
                }
                sb.append(quote(tags.toString()));
            } else {
                sb.append(quote(text(value)));
            }
        }
        return sb.toString();
    }

    static String quote(String value) {
        boolean needsQuotes = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    @Override
    public String getContentType() {
        return "text/csv";
    }
}
