package ph.extremelogic.common.treelog.filter;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.StatusLogger;

/**
 * Evaluation of filter lists shared by loggers, appenders and middleware.
 */
public final class Filters {

    private Filters() {
    }

    /**
     * True when every filter admits the record; an empty list admits everything.
     * A filter that throws counts as a rejection and is reported as a warning.
     */
    public static boolean admitAll(Iterable<? extends Filter> filters, LogRecord record) {
        for (Filter filter : filters) {
            if (!safeAdmit(filter, record)) {
                return false;
            }
        }
        return true;
    }

    public static boolean safeAdmit(Filter filter, LogRecord record) {
        try {
            return filter.admit(record);
        } catch (RuntimeException e) {
            StatusLogger.warn("Filter " + filter.getClass().getSimpleName()
                    + " failed and rejected the record: " + e.getMessage(), e);
            return false;
        }
    }
}
