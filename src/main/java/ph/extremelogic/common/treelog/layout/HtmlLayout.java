package ph.extremelogic.common.treelog.layout;

import java.util.Locale;
import java.util.Map;

/**
 * One HTML table row per record, with a CSS class per level.
 */
public final class HtmlLayout extends StructuredLayout {

    @Override
    protected String render(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("<tr class=\"level-").append(text(fields.get("level")).toLowerCase(Locale.ROOT)).append("\">");
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            sb.append("<td>");
            if (field.getValue() instanceof Map) {
                boolean first = true;
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) field.getValue()).entrySet()) {
                    if (!first) sb.append("<br/>");
                    first = false;
                    sb.append(XmlLayout.escape(String.valueOf(entry.getKey()))).append('=')
                            .append(XmlLayout.escape(text(entry.getValue())));
                }
            } else {
                sb.append(XmlLayout.escape(text(field.getValue())));
            }
            sb.append("</td>");
        }
        sb.append("</tr>");
        return sb.toString();
    }

    @Override
    public String getContentType() {
        return "text/html";
    }
}
