package ph.extremelogic.common.treelog.middleware;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.filter.Filters;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Middleware with a priority and its own filters. Records the filters do not admit
 * pass through unchanged.
 */
public abstract class AbstractMiddleware implements Middleware {
    private final int priority;
    private final List<Filter> filters = new CopyOnWriteArrayList<>();

    protected AbstractMiddleware(int priority) {
        this.priority = priority;
    }

    @Override
    public final LogRecord handle(Logger logger, LogRecord record) {
        if (!Filters.admitAll(filters, record)) {
            return record;
        }
        return process(logger, record);
    }

    protected abstract LogRecord process(Logger logger, LogRecord record);

    @Override
    public int getPriority() {
        return priority;
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

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[priority=" + priority + "]";
    }
}
