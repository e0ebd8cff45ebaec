package ph.extremelogic.common.treelog.middleware;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.appender.RemoteSink;
import ph.extremelogic.common.treelog.layout.PatternLayout;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ErrorAlertMiddlewareTest {

    @Mock
    RemoteSink sink;

    @Test
    @DisplayName("Should alert at and above the threshold only")
    void testThreshold() throws IOException {
        when(sink.send(anyString(), anyString())).thenReturn(true);
        ErrorAlertMiddleware middleware = new ErrorAlertMiddleware(Level.ERROR, sink, "oncall",
                new PatternLayout("{level_name} {message}"), 100);

        LogRecord warning = LogRecord.of("slow", Level.WARNING, "app");
        LogRecord error = LogRecord.of("down", Level.ERROR, "app");

        assertSame(warning, middleware.handle(null, warning));
        assertSame(error, middleware.handle(null, error));

        verify(sink).send("oncall", "ERROR down");
        verifyNoMoreInteractions(sink);
    }

    @Test
    @DisplayName("Should keep the record flowing when the sink fails")
    void testSinkFailure() throws IOException {
        when(sink.send(anyString(), anyString())).thenThrow(new IOException("timeout"));
        ErrorAlertMiddleware middleware = new ErrorAlertMiddleware(sink, "oncall");
        LogRecord critical = LogRecord.of("fire", Level.CRITICAL, "app");

        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err));
        try {
            assertSame(critical, middleware.handle(null, critical));
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString().contains("Alert to oncall failed"));
    }
}
