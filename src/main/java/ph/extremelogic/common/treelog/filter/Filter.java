package ph.extremelogic.common.treelog.filter;

import ph.extremelogic.common.treelog.LogRecord;

/**
 * Admission predicate over a record. Implementations must not change the record.
 */
@FunctionalInterface
public interface Filter {
    boolean admit(LogRecord record);
}
