package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.AppenderException;
import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.StatusLogger;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.layout.Layout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Skeleton for file appenders: the check-rotate-write sequence runs as one critical
 * section under a per-instance lock, with a bounded number of write attempts.
 */
public abstract class AbstractFileAppender extends AbstractAppender {
    static final int MAX_WRITE_ATTEMPTS = 3;
    private static final byte NEWLINE = '\n';

    protected final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    protected LogFile current;

    protected AbstractFileAppender(String name, Layout layout, List<? extends Filter> filters) {
        super(name, layout, filters);
    }

    @Override
    protected final boolean doAppend(Logger owner, LogRecord record) {
        byte[] bytes;
        try {
            bytes = encode(resolveLayout(owner).toSerializable(record));
        } catch (RuntimeException e) {
            return fail(owner, "Failed to format record: " + e.getMessage(), e);
        }

        Exception failure = null;
        lock.lock();
        try {
            if (!isStarted()) {
                return false;
            }
            IOException lastError = null;
            for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
                try {
                    LogFile file = prepare(bytes.length);
                    file.write(bytes);
                    return true;
                } catch (IOException e) {
                    lastError = e;
                    closeCurrent();
                }
            }
            failure = new AppenderException("Write failed after " + MAX_WRITE_ATTEMPTS
                    + " attempts: " + lastError.getMessage(), lastError);
        } catch (AppenderException e) {
            failure = e;
        } finally {
            lock.unlock();
        }
        // Reported outside the lock since the report itself is dispatched to other appenders
        return fail(owner, failure.getMessage(), failure);
    }

    private static byte[] encode(String text) {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        byte[] line = new byte[body.length + 1];
        System.arraycopy(body, 0, line, 0, body.length);
        line[body.length] = NEWLINE;
        return line;
    }

    /**
     * Returns the file the next {@code pendingBytes} go to, opening or rotating as
     * needed. Called with the lock held.
     */
    protected abstract LogFile prepare(int pendingBytes) throws IOException;

    protected void closeCurrent() {
        if (current != null) {
            closeQuietly(current);
            current = null;
        }
    }

    protected void closeQuietly(LogFile file) {
        try {
            file.close();
        } catch (IOException e) {
            StatusLogger.warn("Failed to close " + file.path() + " for appender " + getName(), e);
        }
    }

    /**
     * Hands a file that fell out of retention to the compressor, or deletes it when
     * there is none. A failed compression leaves the file in place.
     */
    protected void retire(Path file, Compressor compressor) {
        if (compressor != null) {
            try {
                compressor.compress(file);
            } catch (IOException | RuntimeException e) {
                StatusLogger.warn("Failed to compress retired log file " + file, e);
            }
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            StatusLogger.warn("Failed to delete retired log file " + file, e);
        }
    }

    @Override
    protected void onStop() {
        lock.lock();
        try {
            closeCurrent();
        } finally {
            lock.unlock();
        }
    }
}
