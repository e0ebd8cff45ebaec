package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.layout.Layout;

import java.io.PrintStream;
import java.util.List;

/**
 * Writes records to a print stream, colored by level unless {@code decorated} is off.
 */
public final class ConsoleAppender extends AbstractAppender {
    private final PrintStream out;
    private final boolean decorated;

    public ConsoleAppender(String name) {
        this(name, null, null, true, null);
    }

    public ConsoleAppender(String name, PrintStream out, boolean decorated) {
        this(name, null, out, decorated, null);
    }

    /**
     * @param out stream to write to, or {@code null} for the {@code System.out} current at each write
     */
    public ConsoleAppender(String name, Layout layout, PrintStream out, boolean decorated,
                           List<? extends Filter> filters) {
        super(name, layout, filters);
        this.out = out;
        this.decorated = decorated;
    }

    @Override
    protected boolean doAppend(Logger owner, LogRecord record) {
        Layout layout = resolveLayout(owner);
        String message;
        try {
            message = decorated ? layout.toDecorated(record) : layout.toSerializable(record);
        } catch (RuntimeException e) {
            return fail(owner, "Failed to format record: " + e.getMessage(), e);
        }

        PrintStream stream = out != null ? out : System.out;
        synchronized (stream) {
            stream.println(message);
            stream.flush();
        }
        if (stream.checkError()) {
            return fail(owner, "Console stream reported an error", null);
        }
        return true;
    }

    @Override
    protected void onStop() {
        if (out != null && out != System.out && out != System.err) {
            out.close();
        }
    }

    public boolean isDecorated() {
        return decorated;
    }
}
