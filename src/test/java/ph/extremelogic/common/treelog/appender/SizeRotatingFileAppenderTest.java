package ph.extremelogic.common.treelog.appender;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.layout.PatternLayout;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SizeRotatingFileAppenderTest {

    @TempDir
    Path tempDir;

    private SizeRotatingFileAppender appender;

    @AfterEach
    void tearDown() {
        if (appender != null) {
            appender.stop();
        }
    }

    private SizeRotatingFileAppender.Builder builder() {
        return SizeRotatingFileAppender.newBuilder("size", tempDir, "app.log")
                .layout(new PatternLayout("{message}"))
                .maxSize(50);
    }

    private void write(int from, int to) {
        for (int i = from; i <= to; i++) {
            assertTrue(appender.append(null, LogRecord.of(String.format("line-%014d", i), Level.INFO, "app")));
        }
    }

    private List<String> read(String name) throws IOException {
        return Files.readAllLines(tempDir.resolve(name));
    }

    @Test
    @DisplayName("Should shift backups and drop the oldest")
    void testShiftAndRetention() throws IOException {
        appender = builder().backupCount(2).build();
        appender.start();

        write(1, 7);

        assertEquals(List.of("line-00000000000007"), read("app.log"));
        assertEquals(List.of("line-00000000000005", "line-00000000000006"), read("app.log.1"));
        assertEquals(List.of("line-00000000000003", "line-00000000000004"), read("app.log.2"));
        assertFalse(Files.exists(tempDir.resolve("app.log.3")));
        assertEquals(3, appender.getRotationCount());
    }

    @Test
    @DisplayName("Should truncate in place without backups")
    void testNoBackups() throws IOException {
        appender = builder().backupCount(0).build();
        appender.start();

        write(1, 3);

        assertEquals(List.of("line-00000000000003"), read("app.log"));
        assertFalse(Files.exists(tempDir.resolve("app.log.1")));
    }

    @Test
    @DisplayName("Should hand the backup falling out of retention to the compressor")
    void testCompression() throws IOException {
        Compressor compressor = mock(Compressor.class);
        appender = builder().backupCount(1).compressor(compressor).build();
        appender.start();

        write(1, 5);

        verify(compressor).compress(tempDir.resolve("app.log.1"));
        verifyNoMoreInteractions(compressor);
        assertEquals(List.of("line-00000000000003", "line-00000000000004"), read("app.log.1"));
    }

    @Test
    @DisplayName("Should keep logging when compression fails")
    void testCompressionFailure() throws IOException {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err));
        try {
            Compressor compressor = mock(Compressor.class);
            when(compressor.compress(any())).thenThrow(new IOException("disk full"));
            appender = builder().backupCount(1).compressor(compressor).build();
            appender.start();

            write(1, 5);

            assertEquals(List.of("line-00000000000005"), read("app.log"));
            assertTrue(err.toString().contains("Failed to compress"));
        } finally {
            System.setErr(originalErr);
        }
    }

    @Test
    @DisplayName("Should reject a non-positive size and a negative backup count")
    void testValidation() {
        assertThrows(ConfigurationException.class, () -> builder().maxSize(0).build());
        assertThrows(ConfigurationException.class, () -> builder().backupCount(-1).build());
    }
}
