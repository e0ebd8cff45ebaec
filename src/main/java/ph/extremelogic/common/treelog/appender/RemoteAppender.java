package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.layout.Layout;

import java.util.List;
import java.util.Objects;

/**
 * Forwards formatted records to a {@link RemoteSink}. A rejected send or any exception
 * from the sink is a non-fatal delivery failure.
 */
public final class RemoteAppender extends AbstractAppender {
    private final RemoteSink sink;
    private final String destinationId;

    public RemoteAppender(String name, RemoteSink sink, String destinationId) {
        this(name, sink, destinationId, null, null);
    }

    public RemoteAppender(String name, RemoteSink sink, String destinationId, Layout layout,
                          List<? extends Filter> filters) {
        super(name, layout, filters);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.destinationId = Objects.requireNonNull(destinationId, "destinationId");
    }

    @Override
    protected boolean doAppend(Logger owner, LogRecord record) {
        boolean delivered;
        try {
            delivered = sink.send(destinationId, resolveLayout(owner).toSerializable(record));
        } catch (Exception e) {
            return fail(owner, "Delivery to " + destinationId + " failed: " + e.getMessage(), e);
        }
        if (!delivered) {
            return fail(owner, "Delivery to " + destinationId + " was rejected", null);
        }
        return true;
    }

    public String getDestinationId() {
        return destinationId;
    }
}
