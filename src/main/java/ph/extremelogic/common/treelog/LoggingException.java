package ph.extremelogic.common.treelog;

/**
 * Base type for every error raised by the logging library.
 */
public class LoggingException extends RuntimeException {

    public LoggingException(String message) {
        super(message);
    }

    public LoggingException(String message, Throwable cause) {
        super(message, cause);
    }
}
