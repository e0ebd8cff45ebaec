package ph.extremelogic.common.treelog.layout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import ph.extremelogic.common.treelog.LoggingException;

import java.util.Map;

/**
 * One JSON object per record.
 */
public final class JsonLayout extends StructuredLayout {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    protected String render(Map<String, Object> fields) {
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new LoggingException("Failed to serialize record as JSON", e);
        }
    }

    @Override
    public String getContentType() {
        return "application/json";
    }
}
