package ph.extremelogic.common.treelog.middleware;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.StatusLogger;
import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.appender.RemoteSink;
import ph.extremelogic.common.treelog.layout.Layout;
import ph.extremelogic.common.treelog.layout.PatternLayout;

import java.util.Objects;

/**
 * Sends records at or above a threshold to a remote destination, typically as an
 * outer step once the appenders are done. The record itself is passed on unchanged.
 */
public class ErrorAlertMiddleware extends AbstractMiddleware {
    private final Level threshold;
    private final RemoteSink sink;
    private final String destinationId;
    private final Layout layout;

    public ErrorAlertMiddleware(RemoteSink sink, String destinationId) {
        this(Level.ERROR, sink, destinationId, new PatternLayout(), 100);
    }

    public ErrorAlertMiddleware(Level threshold, RemoteSink sink, String destinationId,
                                Layout layout, int priority) {
        super(priority);
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.destinationId = Objects.requireNonNull(destinationId, "destinationId");
        this.layout = layout != null ? layout : new PatternLayout();
    }

    @Override
    protected LogRecord process(Logger logger, LogRecord record) {
        if (record.getLevel().isBelow(threshold)) {
            return record;
        }
        try {
            if (!sink.send(destinationId, layout.toSerializable(record))) {
                StatusLogger.warn("Alert to " + destinationId + " was rejected");
            }
        } catch (Exception e) {
            StatusLogger.warn("Alert to " + destinationId + " failed: " + e.getMessage(), e);
        }
        return record;
    }

    public Level getThreshold() {
        return threshold;
    }

    public String getDestinationId() {
        return destinationId;
    }
}
