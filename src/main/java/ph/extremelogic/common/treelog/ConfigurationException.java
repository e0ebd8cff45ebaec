package ph.extremelogic.common.treelog;

/**
 * Raised when a logger, appender, filter, layout or level cannot be constructed from
 * the values it was given. Always thrown synchronously from the constructing call.
 */
public class ConfigurationException extends LoggingException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
