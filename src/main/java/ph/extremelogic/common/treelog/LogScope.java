package ph.extremelogic.common.treelog;

import ph.extremelogic.common.treelog.api.Level;

/**
 * Logs {@code "Start: <message>"} when opened and {@code "End: <message>"} when closed,
 * unless custom start and end messages were given.
 * A failure inside the block is logged at ERROR through {@link #fail(Throwable)}.
 *
 * <pre>
 * try (LogScope scope = logger.scope("import batch")) {
 *     ...
 * }
 * </pre>
 */
public final class LogScope implements AutoCloseable {
    private final Logger logger;
    private final String message;
    private final Level level;
    private final String endMessage;
    private boolean closed;

    LogScope(Logger logger, String message, Level level, String startMessage, String endMessage) {
        this.logger = logger;
        this.message = message;
        this.level = level;
        this.endMessage = endMessage != null ? endMessage : "End: " + message;
        logger.log(startMessage != null ? startMessage : "Start: " + message, level);
    }

    public void fail(Throwable error) {
        logger.log("Error in block: " + message + " - " + error.getMessage(), Level.ERROR);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.log(endMessage, level);
    }

    public String getMessage() {
        return message;
    }
}
