package ph.extremelogic.common.treelog.appender;

import java.io.IOException;

/**
 * Delivery channel for a remote destination such as a chat bot or webhook.
 */
@FunctionalInterface
public interface RemoteSink {

    /**
     * @return {@code true} when the destination accepted the text
     */
    boolean send(String destinationId, String text) throws IOException;
}
