package ph.extremelogic.common.treelog;

import ph.extremelogic.common.treelog.api.Level;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One log event. Instances are immutable: middleware that changes a record returns a
 * derived copy, and every appender of a logger sees the same instance.
 */
public final class LogRecord {
    private final String message;
    private final Level level;
    private final String loggerName;
    private final String prefix;
    private final Instant createdAt;
    private final String parentName;
    private final String threadName;
    private final Map<String, Object> extra;
    private final List<String> tags;
    private final String category;

    public LogRecord(String message, Level level, String loggerName, String prefix,
                     Instant createdAt, String parentName, String threadName,
                     Map<String, Object> extra) {
        this(message, level, loggerName, prefix, createdAt, parentName, threadName, extra, null, null);
    }

    /**
     * @param tags     tags of the creating logger, copied; may be {@code null}
     * @param category category of the creating logger; may be {@code null}
     */
    public LogRecord(String message, Level level, String loggerName, String prefix,
                     Instant createdAt, String parentName, String threadName,
                     Map<String, Object> extra, List<String> tags, String category) {
        this.message = message != null ? message : "";
        this.level = Objects.requireNonNull(level, "level");
        this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
        this.prefix = prefix != null ? prefix : loggerName;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.parentName = parentName;
        this.threadName = threadName != null ? threadName : Thread.currentThread().getName();
        this.extra = extra == null || extra.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        this.tags = tags == null || tags.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(tags));
        this.category = category;
    }

    /**
     * Record stamped with the current time and thread.
     */
    public static LogRecord of(String message, Level level, String loggerName) {
        return new LogRecord(message, level, loggerName, null, Instant.now(), null, null, null);
    }

    public String getMessage() { return message; }
    public Level getLevel() { return level; }
    public String getLoggerName() { return loggerName; }
    public String getPrefix() { return prefix; }
    public Instant getCreatedAt() { return createdAt; }
    public String getParentName() { return parentName; }
    public String getThreadName() { return threadName; }
    public Map<String, Object> getExtra() { return extra; }
    public List<String> getTags() { return tags; }
    public String getCategory() { return category; }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public Object getExtra(String key) {
        return extra.get(key);
    }

    public LogRecord withMessage(String newMessage) {
        return new LogRecord(newMessage, level, loggerName, prefix, createdAt, parentName,
                threadName, extra, tags, category);
    }

    public LogRecord withExtra(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(extra);
        merged.put(key, value);
        return new LogRecord(message, level, loggerName, prefix, createdAt, parentName,
                threadName, merged, tags, category);
    }

    /**
     * Copy whose extras are this record's extras overlaid with {@code values}.
     */
    public LogRecord withExtras(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(extra);
        merged.putAll(values);
        return new LogRecord(message, level, loggerName, prefix, createdAt, parentName,
                threadName, merged, tags, category);
    }

    /**
     * Copy re-stamped for another logger. Message, level, time, thread, extras, tags and
     * category are kept.
     */
    public LogRecord restamp(String newLoggerName, String newPrefix, String newParentName) {
        return new LogRecord(message, level, newLoggerName, newPrefix, createdAt, newParentName,
                threadName, extra, tags, category);
    }

    @Override
    public String toString() {
        return "LogRecord[" + level + " " + loggerName + ": " + message + "]";
    }
}
