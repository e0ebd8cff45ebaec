package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.StatusLogger;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.filter.Filters;
import ph.extremelogic.common.treelog.layout.Layout;
import ph.extremelogic.common.treelog.layout.PatternLayout;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Common appender state: name, own filters, optional layout override and the
 * started flag.
 */
public abstract class AbstractAppender implements Appender {
    private static final Layout FALLBACK_LAYOUT = new PatternLayout();

    private final String name;
    private final Layout layout;
    private final List<Filter> filters = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    protected AbstractAppender(String name, Layout layout, List<? extends Filter> filters) {
        this.name = Objects.requireNonNull(name, "name");
        this.layout = layout;
        if (filters != null) {
            this.filters.addAll(filters);
        }
    }

    @Override
    public final boolean append(Logger owner, LogRecord record) {
        if (!started.get()) {
            return false;
        }
        if (!Filters.admitAll(filters, record)) {
            return false;
        }
        return doAppend(owner, record);
    }

    protected abstract boolean doAppend(Logger owner, LogRecord record);

    @Override
    public final void start() {
        if (started.compareAndSet(false, true)) {
            try {
                onStart();
            } catch (RuntimeException e) {
                started.set(false);
                throw e;
            }
        }
    }

    @Override
    public final void stop() {
        if (started.compareAndSet(true, false)) {
            onStop();
        }
    }

    protected void onStart() {
    }

    protected void onStop() {
    }

    @Override
    public boolean isStarted() {
        return started.get();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void addFilter(Filter filter) {
        filters.add(Objects.requireNonNull(filter, "filter"));
    }

    @Override
    public boolean removeFilter(Filter filter) {
        return filters.remove(filter);
    }

    @Override
    public List<Filter> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    @Override
    public Layout getLayout() {
        return layout;
    }

    protected Layout resolveLayout(Logger owner) {
        if (layout != null) {
            return layout;
        }
        return owner != null ? owner.getLayout() : FALLBACK_LAYOUT;
    }

    /**
     * Reports a failure through the owner, or to the status logger when there is none.
     * Always returns {@code false} so callers can {@code return fail(...)}.
     */
    protected final boolean fail(Logger owner, String message, Throwable cause) {
        if (owner != null) {
            owner.reportAppenderFailure(this, message, cause);
        } else {
            StatusLogger.error("Appender " + name + ": " + message, cause);
        }
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
