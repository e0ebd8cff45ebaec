package ph.extremelogic.common.treelog.layout;

import java.util.List;
import java.util.Map;

/**
 * One {@code <record>} element per record. Tags become {@code <tag>} children and extras
 * {@code <entry key="...">} children.
 */
public final class XmlLayout extends StructuredLayout {

    @Override
    protected String render(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("<record>");
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            if (field.getValue() instanceof Map) {
                sb.append('<').append(field.getKey()).append('>');
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) field.getValue()).entrySet()) {
                    sb.append("<entry key=\"").append(escape(String.valueOf(entry.getKey()))).append("\">")
                            .append(escape(text(entry.getValue()))).append("</entry>");
                }
                sb.append("</").append(field.getKey()).append('>');
            } else if (field.getValue() instanceof List) {
                sb.append('<').append(field.getKey()).append('>');
                for (Object tag : (List<?>) field.getValue()) {
                    sb.append("<tag>").append(escape(text(tag))).append("</tag>");
                }
                sb.append("</").append(field.getKey()).append('>');
            } else {
                sb.append('<').append(field.getKey()).append('>')
                        .append(escape(text(field.getValue())))
                        .append("</").append(field.getKey()).append('>');
            }
        }
        sb.append("</record>");
        return sb.toString();
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '&': sb.append("&amp;"); break;
                case '"': sb.append("&quot;"); break;
                case '\'': sb.append("&apos;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String getContentType() {
        return "application/xml";
    }
}
