package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.layout.Layout;

import java.util.List;

/**
 * Output sink for log records.
 *
 * <p>{@link #append} never throws for I/O or delivery problems: the appender reports
 * them through {@link Logger#reportAppenderFailure} of the owning logger and returns
 * {@code false}. A record rejected by the appender's own filters also yields
 * {@code false}, without any report.</p>
 */
public interface Appender {

    boolean append(Logger owner, LogRecord record);

    void start();

    /**
     * Releases resources. Calling it again is a no-op.
     */
    void stop();

    boolean isStarted();

    String getName();

    void addFilter(Filter filter);

    boolean removeFilter(Filter filter);

    List<Filter> getFilters();

    /**
     * Layout override, or {@code null} to use the owning logger's layout.
     */
    Layout getLayout();
}
