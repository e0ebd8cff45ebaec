package ph.extremelogic.common.treelog.layout;

import java.util.Map;

/**
 * One Markdown table row per record.
 */
public final class MarkdownLayout extends StructuredLayout {
    public static final String HEADER = "| time | name | prefix | parent | level | level_value | message | thread | category | tags | extra |";

    @Override
    protected String render(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder(256);
        sb.append('|');
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            sb.append(' ');
            if (field.getValue() instanceof Map) {
                boolean first = true;
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) field.getValue()).entrySet()) {
                    if (!first) sb.append(", ");
                    first = false;
                    sb.append(escape(String.valueOf(entry.getKey()))).append('=').append(escape(text(entry.getValue())));
                }
            } else {
                sb.append(escape(text(field.getValue())));
            }
            sb.append(" |");
        }
        return sb.toString();
    }

    private static String escape(String value) {
        return value.replace("|", "\\|").replace("\r", "").replace("\n", "<br>");
    }

    @Override
    public String getContentType() {
        return "text/markdown";
    }
}
