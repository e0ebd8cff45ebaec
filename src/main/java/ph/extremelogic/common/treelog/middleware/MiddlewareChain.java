package ph.extremelogic.common.treelog.middleware;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.StatusLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of middleware. Writers copy and republish the list; {@link #apply}
 * iterates whatever snapshot was current when it started.
 */
public final class MiddlewareChain {
    private final String name;
    private final Object writeLock = new Object();
    private volatile List<Middleware> steps = Collections.emptyList();

    public MiddlewareChain(String name) {
        this.name = name;
    }

    /**
     * Inserts after every step with a priority less than or equal to the new one's.
     */
    public void add(Middleware middleware) {
        Objects.requireNonNull(middleware, "middleware");
        synchronized (writeLock) {
            List<Middleware> next = new ArrayList<>(steps.size() + 1);
            next.addAll(steps);
            int at = next.size();
            while (at > 0 && next.get(at - 1).getPriority() > middleware.getPriority()) {
                at--;
            }
            next.add(at, middleware);
            steps = Collections.unmodifiableList(next);
        }
    }

    public boolean remove(Middleware middleware) {
        synchronized (writeLock) {
            List<Middleware> next = new ArrayList<>(steps);
            boolean removed = next.remove(middleware);
            if (removed) {
                steps = Collections.unmodifiableList(next);
            }
            return removed;
        }
    }

    /**
     * Runs every step in order.
     *
     * @return the final record, or {@code null} if a step rejected it
     */
    public LogRecord apply(Logger logger, LogRecord record) {
        LogRecord current = record;
        for (Middleware step : steps) {
            LogRecord next;
            try {
                next = step.handle(logger, current);
            } catch (RuntimeException e) {
                StatusLogger.warn("Middleware " + step + " in " + name + " chain of logger "
                        + (logger != null ? logger.getName() : "?") + " failed: " + e.getMessage(), e);
                continue;
            }
            if (next == null) {
                return null;
            }
            current = next;
        }
        return current;
    }

    public List<Middleware> getSteps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }
}
