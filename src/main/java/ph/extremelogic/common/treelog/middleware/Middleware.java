package ph.extremelogic.common.treelog.middleware;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;

/**
 * Pre- or post-processing step around a logger's appenders.
 */
public interface Middleware {

    /**
     * @return the record to hand to the next step, possibly a derived copy, or
     *         {@code null} to reject it
     */
    LogRecord handle(Logger logger, LogRecord record);

    /**
     * Steps run in ascending priority.
     */
    int getPriority();
}
