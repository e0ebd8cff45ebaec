package ph.extremelogic.common.treelog;

import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.api.ThreadContext;
import ph.extremelogic.common.treelog.appender.Appender;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.filter.Filters;
import ph.extremelogic.common.treelog.layout.Layout;
import ph.extremelogic.common.treelog.layout.PatternLayout;
import ph.extremelogic.common.treelog.message.ParameterizedMessage;
import ph.extremelogic.common.treelog.middleware.Middleware;
import ph.extremelogic.common.treelog.middleware.MiddlewareChain;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A node of the logger tree and the dispatcher for its records.
 *
 * <p>A call passes the level gate, builds a {@link LogRecord} from the logger context,
 * the {@link ThreadContext} and the call-site extras, then runs the effective filters,
 * the inner middleware, every appender and the outer middleware. When {@code propagate}
 * is on, the call-site record is re-stamped and offered to each ancestor in turn.</p>
 *
 * <p>Loggers are created by a {@link LoggerRegistry}, never directly.</p>
 */
public final class Logger {
    private static final int REJECTED = -1;

    private static final ThreadLocal<Boolean> REPORTING_FAILURE = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final LoggerRegistry registry;
    private final String name;
    private final Logger parent;
    private final List<Logger> children = new CopyOnWriteArrayList<>();
    private final List<Appender> appenders = new CopyOnWriteArrayList<>();
    private final List<Filter> filters = new CopyOnWriteArrayList<>();
    private final List<String> tags = new CopyOnWriteArrayList<>();
    private final MiddlewareChain innerMiddleware;
    private final MiddlewareChain outerMiddleware;
    private final Object contextLock = new Object();

    private volatile String prefix;
    private volatile Level level;
    private volatile boolean enabled;
    private volatile boolean propagate;
    private volatile boolean inheritFilters;
    private volatile String category;
    private volatile Layout layout;
    private volatile Map<String, Object> context = Collections.emptyMap();

    Logger(LoggerRegistry registry, Builder builder, Logger parent) {
        this.registry = registry;
        this.name = builder.name;
        this.parent = parent;
        this.prefix = builder.prefix;
        this.level = builder.level;
        this.enabled = builder.enabled;
        this.propagate = builder.propagate && parent != null;
        this.inheritFilters = builder.inheritFilters;
        this.category = builder.category;
        this.tags.addAll(builder.tags);
        this.layout = builder.layout != null ? builder.layout : new PatternLayout();
        this.innerMiddleware = new MiddlewareChain("inner");
        this.outerMiddleware = new MiddlewareChain("outer");
        this.filters.addAll(builder.filters);
        addAppenders(builder.appenders);
    }

    /**
     * Starts and attaches the appenders in order. If one fails to start, the appenders
     * attached by this call are detached, those it started are stopped again, and the
     * failure is rethrown.
     */
    public void addAppenders(List<? extends Appender> toAttach) {
        List<Appender> startedHere = new ArrayList<>();
        List<Appender> attachedHere = new ArrayList<>();
        try {
            for (Appender appender : toAttach) {
                boolean wasStarted = appender.isStarted();
                addAppender(appender);
                attachedHere.add(appender);
                if (!wasStarted) {
                    startedHere.add(appender);
                }
            }
        } catch (RuntimeException e) {
            appenders.removeAll(attachedHere);
            for (Appender appender : startedHere) {
                try {
                    appender.stop();
                } catch (RuntimeException stopError) {
                    e.addSuppressed(stopError);
                }
            }
            throw e;
        }
    }

    // ---- logging ------------------------------------------------------------------

    public boolean log(String message, Level level) {
        return log(message, level, null);
    }

    /**
     * Logs one message.
     *
     * @return {@code false} when the logger is disabled, the level is below the
     *         logger's level, a filter rejected the record or an inner middleware
     *         step rejected it; {@code true} otherwise, even if an appender failed
     */
    public boolean log(String message, Level level, Map<String, ?> extra) {
        Objects.requireNonNull(level, "level");
        if (!isEnabledFor(level)) {
            return false;
        }
        return dispatch(createRecord(message, level, extra), null) != REJECTED;
    }

    public boolean isEnabledFor(Level level) {
        return enabled && level.isAtLeast(this.level);
    }

    public boolean trace(String message, Object... args) {
        return logFormatted(Level.TRACE, message, args);
    }

    public boolean debug(String message, Object... args) {
        return logFormatted(Level.DEBUG, message, args);
    }

    public boolean info(String message, Object... args) {
        return logFormatted(Level.INFO, message, args);
    }

    public boolean success(String message, Object... args) {
        return logFormatted(Level.SUCCESS, message, args);
    }

    public boolean warning(String message, Object... args) {
        return logFormatted(Level.WARNING, message, args);
    }

    public boolean warn(String message, Object... args) {
        return logFormatted(Level.WARNING, message, args);
    }

    public boolean fail(String message, Object... args) {
        return logFormatted(Level.FAIL, message, args);
    }

    public boolean error(String message, Object... args) {
        return logFormatted(Level.ERROR, message, args);
    }

    public boolean critical(String message, Object... args) {
        return logFormatted(Level.CRITICAL, message, args);
    }

    public boolean fatal(String message, Object... args) {
        return logFormatted(Level.CRITICAL, message, args);
    }

    private boolean logFormatted(Level level, String message, Object[] args) {
        // Skip formatting for records that would be dropped anyway
        if (!isEnabledFor(level)) {
            return false;
        }
        String text = args == null || args.length == 0 ? message : ParameterizedMessage.format(message, args);
        return log(text, level, null);
    }

    public boolean exception(String message, Throwable throwable) {
        return exception(message, throwable, Level.ERROR, null);
    }

    public boolean exception(String message, Throwable throwable, Level level) {
        return exception(message, throwable, level, null);
    }

    /**
     * Logs {@code "Exception: " + message} with the throwable's type, message and stack
     * trace as the extras {@code exception_type}, {@code exception_message} and
     * {@code stack_trace}.
     */
    public boolean exception(String message, Throwable throwable, Level level, Map<String, ?> extra) {
        Objects.requireNonNull(level, "level");
        if (!isEnabledFor(level)) {
            return false;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        if (throwable != null) {
            details.put("exception_type", throwable.getClass().getName());
            details.put("exception_message", throwable.getMessage());
            details.put("stack_trace", stackTrace(throwable));
        }
        if (extra != null) {
            details.putAll(extra);
        }
        return log("Exception: " + message, level, details);
    }

    static String stackTrace(Throwable throwable) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            throwable.printStackTrace(pw);
        }
        return sw.toString();
    }

    public <T> T catchExceptions(String message, Callable<T> block) throws Exception {
        return catchExceptions(message, Level.ERROR, null, block);
    }

    /**
     * Runs {@code block}; an exception it throws is logged with
     * {@link #exception(String, Throwable, Level, Map)} and rethrown. Nothing is logged
     * when the block completes normally.
     */
    public <T> T catchExceptions(String message, Level level, Map<String, ?> extra, Callable<T> block) throws Exception {
        Objects.requireNonNull(block, "block");
        try {
            return block.call();
        } catch (Exception e) {
            exception(message, e, level, extra);
            throw e;
        }
    }

    public LogScope scope(String message) {
        return scope(message, Level.INFO);
    }

    public LogScope scope(String message, Level level) {
        return scope(message, level, null, null);
    }

    /**
     * Opens a scope that logs a start message now and an end message on close.
     *
     * @param startMessage replaces {@code "Start: " + message} when not {@code null}
     * @param endMessage   replaces {@code "End: " + message} when not {@code null}
     */
    public LogScope scope(String message, Level level, String startMessage, String endMessage) {
        return new LogScope(this, message, level, startMessage, endMessage);
    }

    public <T> T scoped(String message, Callable<T> block) throws Exception {
        return scoped(message, Level.INFO, null, null, block);
    }

    /**
     * Runs {@code block} inside a {@link #scope(String, Level, String, String)}. An
     * exception thrown by the block is logged at ERROR and rethrown.
     */
    public <T> T scoped(String message, Level level, String startMessage, String endMessage,
                        Callable<T> block) throws Exception {
        try (LogScope scope = scope(message, level, startMessage, endMessage)) {
            try {
                return block.call();
            } catch (Exception e) {
                scope.fail(e);
                throw e;
            }
        }
    }

    public CompletableFuture<Boolean> logAsync(String message, Level level) {
        return logAsync(message, level, null);
    }

    /**
     * Runs the same pipeline as {@link #log(String, Level, Map)} on the registry's
     * async processor. The record, including thread context and timestamp, is built on
     * the calling thread.
     */
    public CompletableFuture<Boolean> logAsync(String message, Level level, Map<String, ?> extra) {
        Objects.requireNonNull(level, "level");
        if (!isEnabledFor(level)) {
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }
        LogRecord record = createRecord(message, level, extra);
        return registry.getAsyncProcessor().submit(this, record);
    }

    // ---- dispatch -----------------------------------------------------------------

    private LogRecord createRecord(String message, Level level, Map<String, ?> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        if (!ThreadContext.isEmpty()) {
            merged.putAll(ThreadContext.getContext());
        }
        if (extra != null) {
            merged.putAll(extra);
        }
        return new LogRecord(message, level, name, prefix, Instant.now(), parentName(),
                Thread.currentThread().getName(), merged, tags, category);
    }

    /**
     * Full pipeline for a record created by this logger, including propagation.
     *
     * @return number of appenders that accepted the record, or {@link #REJECTED}
     */
    int dispatch(LogRecord record, Appender excluded) {
        if (!Filters.admitAll(getEffectiveFilters(), record)) {
            return REJECTED;
        }
        LogRecord processed = innerMiddleware.apply(this, record);
        if (processed == null) {
            return REJECTED;
        }
        int delivered = emit(processed, excluded);
        outerMiddleware.apply(this, processed);

        if (propagate) {
            delivered += propagateUp(record, excluded);
        }
        return delivered;
    }

    /**
     * Entry point for records built on another thread by {@link #logAsync}.
     */
    boolean process(LogRecord record) {
        return dispatch(record, null) != REJECTED;
    }

    private int propagateUp(LogRecord record, Appender excluded) {
        int delivered = 0;
        LogRecord current = record;
        Logger child = this;
        Logger ancestor = parent;
        while (child.propagate && ancestor != null) {
            current = current.restamp(ancestor.name, ancestor.prefix, ancestor.parentName());
            delivered += ancestor.receivePropagated(current, excluded);
            child = ancestor;
            ancestor = ancestor.parent;
        }
        return delivered;
    }

    /**
     * Handles a record from a descendant with this logger's gate, filters, middleware
     * and directly-owned appenders. Does not propagate further.
     */
    private int receivePropagated(LogRecord record, Appender excluded) {
        if (!isEnabledFor(record.getLevel())) {
            return 0;
        }
        if (!Filters.admitAll(getEffectiveFilters(), record)) {
            return 0;
        }
        LogRecord processed = innerMiddleware.apply(this, record);
        if (processed == null) {
            return 0;
        }
        int delivered = emit(processed, excluded);
        outerMiddleware.apply(this, processed);
        return delivered;
    }

    private int emit(LogRecord record, Appender excluded) {
        int delivered = 0;
        for (Appender appender : appenders) {
            if (appender == excluded) {
                continue;
            }
            try {
                if (appender.append(this, record)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                reportAppenderFailure(appender, "Unexpected error: " + e, e);
            }
        }
        return delivered;
    }

    /**
     * Logs an appender failure as an ERROR record with the extras {@code appender} and
     * {@code error}. The record goes through this logger's pipeline and propagation,
     * skipping the failing appender. A failure raised while a report is already in
     * progress on this thread, or a report nobody accepted, goes to the
     * {@link StatusLogger}.
     */
    public void reportAppenderFailure(Appender appender, String message, Throwable cause) {
        String appenderName = appender != null ? appender.getName() : "?";
        if (REPORTING_FAILURE.get()) {
            StatusLogger.error("Appender " + appenderName + " of logger " + name
                    + " failed while reporting another failure: " + message, cause);
            return;
        }
        REPORTING_FAILURE.set(Boolean.TRUE);
        try {
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("appender", appenderName);
            extra.put("error", cause != null ? cause.toString() : message);
            LogRecord record = new LogRecord("Appender " + appenderName + " failed: " + message,
                    Level.ERROR, name, prefix, Instant.now(), parentName(),
                    Thread.currentThread().getName(), extra, tags, category);

            int delivered = isEnabledFor(Level.ERROR) ? dispatch(record, appender) : REJECTED;
            if (delivered <= 0) {
                StatusLogger.error("Appender " + appenderName + " of logger " + name + " failed: " + message, cause);
            }
        } finally {
            REPORTING_FAILURE.remove();
        }
    }

    // ---- configuration --------------------------------------------------------------

    /**
     * Starts the appender and attaches it. If {@link Appender#start()} throws, the
     * appender is not attached.
     */
    public void addAppender(Appender appender) {
        Objects.requireNonNull(appender, "appender");
        appender.start();
        appenders.add(appender);
    }

    /**
     * Detaches the appender without stopping it; it may be shared with other loggers.
     */
    public boolean removeAppender(Appender appender) {
        return appenders.remove(appender);
    }

    public List<Appender> getAppenders() {
        return Collections.unmodifiableList(appenders);
    }

    public void addFilter(Filter filter) {
        filters.add(Objects.requireNonNull(filter, "filter"));
    }

    public boolean removeFilter(Filter filter) {
        return filters.remove(filter);
    }

    public List<Filter> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    /**
     * Filters of the ancestors, furthest first, followed by this logger's own. The climb
     * stops at the first logger that does not inherit filters; that logger's own filters
     * are still included.
     */
    public List<Filter> getEffectiveFilters() {
        if (parent == null || !inheritFilters) {
            return getFilters();
        }
        Deque<Logger> chain = new ArrayDeque<>();
        for (Logger l = this; l != null; l = l.inheritFilters ? l.parent : null) {
            chain.push(l);
        }
        List<Filter> effective = new ArrayList<>();
        for (Logger l : chain) {
            effective.addAll(l.filters);
        }
        return effective;
    }

    public void addTag(String tag) {
        tags.add(Objects.requireNonNull(tag, "tag"));
    }

    /**
     * Removes one occurrence of the tag.
     */
    public boolean removeTag(String tag) {
        return tags.remove(tag);
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public String getCategory() { return category; }

    public void setCategory(String category) {
        this.category = category;
    }

    public boolean isInheritFilters() { return inheritFilters; }

    public void setInheritFilters(boolean inheritFilters) {
        this.inheritFilters = inheritFilters;
    }

    public void addInnerMiddleware(Middleware middleware) {
        innerMiddleware.add(middleware);
    }

    public boolean removeInnerMiddleware(Middleware middleware) {
        return innerMiddleware.remove(middleware);
    }

    public void addOuterMiddleware(Middleware middleware) {
        outerMiddleware.add(middleware);
    }

    public boolean removeOuterMiddleware(Middleware middleware) {
        return outerMiddleware.remove(middleware);
    }

    public List<Middleware> getInnerMiddleware() {
        return innerMiddleware.getSteps();
    }

    public List<Middleware> getOuterMiddleware() {
        return outerMiddleware.getSteps();
    }

    public void addContext(String key, Object value) {
        Objects.requireNonNull(key, "key");
        synchronized (contextLock) {
            Map<String, Object> next = new LinkedHashMap<>(context);
            next.put(key, value);
            context = Collections.unmodifiableMap(next);
        }
    }

    public void addContext(Map<String, ?> values) {
        synchronized (contextLock) {
            Map<String, Object> next = new LinkedHashMap<>(context);
            next.putAll(values);
            context = Collections.unmodifiableMap(next);
        }
    }

    public void removeContext(String key) {
        synchronized (contextLock) {
            if (context.containsKey(key)) {
                Map<String, Object> next = new LinkedHashMap<>(context);
                next.remove(key);
                context = Collections.unmodifiableMap(next);
            }
        }
    }

    public void clearContext() {
        synchronized (contextLock) {
            context = Collections.emptyMap();
        }
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public String getName() { return name; }
    public Logger getParent() { return parent; }
    public LoggerRegistry getRegistry() { return registry; }

    public List<Logger> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(Logger child) {
        children.add(child);
    }

    /**
     * Prefix stamped on records, or {@code null} to use the logger name.
     */
    public String getPrefix() { return prefix; }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public Level getLevel() { return level; }

    public void setLevel(Level level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    public boolean isEnabled() { return enabled; }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isPropagate() { return propagate; }

    /**
     * Has no effect on the root logger, which has no parent.
     */
    public void setPropagate(boolean propagate) {
        this.propagate = propagate && parent != null;
    }

    public Layout getLayout() { return layout; }

    public void setLayout(Layout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    private String parentName() {
        return parent != null ? parent.name : null;
    }

    @Override
    public String toString() {
        return "Logger[" + name + ", level=" + level + "]";
    }

    /**
     * Settings for a new logger; obtained from {@link LoggerRegistry#newLogger(String)}.
     */
    public static final class Builder {
        private final LoggerRegistry registry;
        private final String name;
        private String prefix;
        private Level level = Level.NOTSET;
        private String parentName;
        private Logger parent;
        private boolean propagate = true;
        private boolean enabled = true;
        private boolean inheritFilters = true;
        private String category;
        private final List<String> tags = new ArrayList<>();
        private Layout layout;
        private final List<Appender> appenders = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();

        Builder(LoggerRegistry registry, String name) {
            this.registry = registry;
            this.name = name;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder level(Level level) {
            this.level = Objects.requireNonNull(level, "level");
            return this;
        }

        public Builder parent(Logger parent) {
            this.parent = parent;
            this.parentName = null;
            return this;
        }

        /**
         * Parent by name; created on demand like {@link LoggerRegistry#getLogger(String)}.
         */
        public Builder parent(String parentName) {
            this.parentName = parentName;
            this.parent = null;
            return this;
        }

        public Builder propagate(boolean propagate) {
            this.propagate = propagate;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder inheritFilters(boolean inheritFilters) {
            this.inheritFilters = inheritFilters;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(Objects.requireNonNull(tag, "tag"));
            return this;
        }

        public Builder tags(List<String> tags) {
            for (String tag : tags) {
                tag(tag);
            }
            return this;
        }

        public Builder layout(Layout layout) {
            this.layout = layout;
            return this;
        }

        public Builder appender(Appender appender) {
            this.appenders.add(Objects.requireNonNull(appender, "appender"));
            return this;
        }

        public Builder appenders(List<? extends Appender> appenders) {
            for (Appender appender : appenders) {
                appender(appender);
            }
            return this;
        }

        public Builder filter(Filter filter) {
            this.filters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder filters(List<? extends Filter> filters) {
            for (Filter filter : filters) {
                filter(filter);
            }
            return this;
        }

        String getName() {
            return name;
        }

        Logger resolveParent() {
            if (parent != null) {
                return parent;
            }
            return parentName != null ? registry.getLogger(parentName) : null;
        }

        /**
         * Creates and registers the logger.
         *
         * @throws ConfigurationException if the name is already registered
         */
        public Logger create() {
            return registry.register(this);
        }
    }
}
