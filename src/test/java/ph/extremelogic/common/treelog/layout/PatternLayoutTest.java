package ph.extremelogic.common.treelog.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.api.AnsiColor;
import ph.extremelogic.common.treelog.api.Level;

import java.time.*;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PatternLayoutTest {
    private static final Instant CREATED = LocalDateTime.of(2024, 5, 17, 9, 3, 7).toInstant(ZoneOffset.UTC);

    private static LogRecord record(Map<String, Object> extra) {
        return new LogRecord("disk almost full", Level.WARNING, "app.disk", "DISK", CREATED,
                "app", "worker-1", extra);
    }

    @Test
    @DisplayName("Should render the default pattern")
    void testDefaultPattern() {
        PatternLayout layout = new PatternLayout(PatternLayout.DEFAULT_PATTERN,
                PatternLayout.DEFAULT_TIME_PATTERN, ZoneOffset.UTC);

        assertEquals("[17/05/2024 09:03:07] DISK | WARNING[50]: disk almost full",
                layout.toSerializable(record(null)));
    }

    @Test
    @DisplayName("Should resolve every reserved token")
    void testReservedTokens() {
        PatternLayout layout = new PatternLayout("{date} {name} {parent} {thread} {level_name}",
                "HH:mm", ZoneOffset.UTC);

        assertEquals("2024-05-17 app.disk app worker-1 WARNING", layout.toSerializable(record(null)));
    }

    @Test
    @DisplayName("Should render tags and category, empty when unset")
    void testTagsAndCategory() {
        PatternLayout layout = new PatternLayout("<{category}> {tags} {message}");
        LogRecord tagged = new LogRecord("paid", Level.INFO, "app.pay", null, CREATED, "app", "main",
                null, List.of("billing", "eu"), "audit");

        assertEquals("<audit> [billing, eu] paid", layout.toSerializable(tagged));
        assertEquals("<> [] disk almost full", layout.toSerializable(record(null)));
    }

    @Test
    @DisplayName("Should fall back to the logger name when there is no prefix")
    void testPrefixFallback() {
        LogRecord record = LogRecord.of("m", Level.INFO, "svc");
        assertEquals("svc", new PatternLayout("{prefix}").toSerializable(record));
    }

    @Test
    @DisplayName("Should splice extras by key and keep reserved tokens first")
    void testExtraTokens() {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("user", "bob");
        extra.put("message", "shadowed");

        PatternLayout layout = new PatternLayout("{message} user={user} {extra}");

        assertEquals("disk almost full user=bob {user=bob, message=shadowed}",
                layout.toSerializable(record(extra)));
    }

    @Test
    @DisplayName("Should emit unknown tokens verbatim")
    void testUnknownToken() {
        assertEquals("{nope} {} x", new PatternLayout("{nope} {} x").toSerializable(record(null)));
    }

    @Test
    @DisplayName("Should render elapsed seconds with three decimals")
    void testElapsed() {
        String elapsed = new PatternLayout("{elapsed}").toSerializable(LogRecord.of("m", Level.INFO, "a"));
        assertTrue(elapsed.matches("\\d+\\.\\d{3}"), elapsed);
    }

    @Test
    @DisplayName("Should wrap the plain text in the level color for decorated output")
    void testDecorated() {
        PatternLayout layout = new PatternLayout("{message}");

        assertEquals(AnsiColor.LIGHT_YELLOW.prefix() + "disk almost full" + AnsiColor.RESET,
                layout.toDecorated(record(null)));
    }

    @Test
    @DisplayName("Should reject an invalid time pattern")
    void testInvalidTimePattern() {
        assertThrows(ConfigurationException.class, () -> new PatternLayout("{time}", "yyyy-bb"));
    }
}
