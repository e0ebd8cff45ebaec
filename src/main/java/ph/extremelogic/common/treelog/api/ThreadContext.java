package ph.extremelogic.common.treelog.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-thread key/value context merged into the extras of every record created on
 * that thread. Logger context is applied first, then this context, then call-site
 * extras, so the call site always wins on a key collision.
 */
public final class ThreadContext {
    private static final ThreadLocal<Map<String, Object>> CONTEXT_MAP =
            ThreadLocal.withInitial(() -> new LinkedHashMap<>(8));

    private ThreadContext() {
    }

    public static void put(String key, Object value) {
        CONTEXT_MAP.get().put(key, value);
    }

    public static Object get(String key) {
        return CONTEXT_MAP.get().get(key);
    }

    public static void remove(String key) {
        CONTEXT_MAP.get().remove(key);
    }

    public static void clear() {
        CONTEXT_MAP.get().clear();
    }

    public static boolean isEmpty() {
        return CONTEXT_MAP.get().isEmpty();
    }

    /**
     * Snapshot of the current thread's context.
     */
    public static Map<String, Object> getContext() {
        Map<String, Object> map = CONTEXT_MAP.get();
        return map.isEmpty() ? Collections.emptyMap() : new LinkedHashMap<>(map);
    }

    public static void cleanup() {
        CONTEXT_MAP.remove();
    }
}
