package ph.extremelogic.common.treelog.config;

import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.api.Level;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed reads from a parsed configuration map. Numbers and booleans may be given as
 * their own type or as strings; anything else is a {@link ConfigurationException}
 * naming the offending key.
 */
final class ConfigValues {

    private ConfigValues() {
    }

    static String getString(Map<String, ?> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    static String requireString(Map<String, ?> map, String key, String context) {
        Object value = map.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new ConfigurationException("Missing required key '" + key + "' in " + context);
        }
        return value.toString();
    }

    static long getLong(Map<String, ?> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for '" + key + "': " + value, e);
        }
    }

    static int getInt(Map<String, ?> map, String key, int defaultValue) {
        long value = getLong(map, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigurationException("Value out of range for '" + key + "': " + value);
        }
        return (int) value;
    }

    static boolean getBoolean(Map<String, ?> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new ConfigurationException("Invalid boolean for '" + key + "': " + value);
    }

    static Level getLevel(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        Level level = Level.forName(value.toString());
        if (level == null) {
            throw new ConfigurationException("Unknown level for '" + key + "': " + value);
        }
        return level;
    }

    static LocalTime getTime(Map<String, ?> map, String key, String context) {
        String text = requireString(map, key, context);
        try {
            return LocalTime.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid time for '" + key + "': " + text, e);
        }
    }

    static List<String> getStringList(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("Expected a list for '" + key + "' but got " + value.getClass().getSimpleName());
        }
        List<String> strings = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item == null) {
                throw new ConfigurationException("Null entry in '" + key + "'");
            }
            strings.add(item.toString());
        }
        return strings;
    }

    static Map<String, Object> getMap(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Expected a map for '" + key + "' but got " + value.getClass().getSimpleName());
        }
        return stringKeys((Map<?, ?>) value);
    }

    static List<Map<String, Object>> getMapList(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("Expected a list for '" + key + "' but got " + value.getClass().getSimpleName());
        }
        List<Map<String, Object>> maps = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException("Expected only maps in '" + key + "' but found " + item);
            }
            maps.add(stringKeys((Map<?, ?>) item));
        }
        return maps;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }
}
