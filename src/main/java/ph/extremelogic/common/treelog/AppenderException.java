package ph.extremelogic.common.treelog;

/**
 * Write or delivery failure inside an appender. Appenders catch it themselves and
 * report it through the owning logger; it never reaches the caller of a log method.
 */
public class AppenderException extends LoggingException {

    public AppenderException(String message) {
        super(message);
    }

    public AppenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
