package ph.extremelogic.common.treelog.appender;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ph.extremelogic.common.treelog.AppenderException;
import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.filter.LevelFilter;
import ph.extremelogic.common.treelog.layout.PatternLayout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RotatingFileAppenderTest {

    @TempDir
    Path tempDir;

    @Mock
    Logger owner;

    private RotatingFileAppender appender;

    @AfterEach
    void tearDown() {
        if (appender != null) {
            appender.stop();
        }
    }

    private RotatingFileAppender.Builder builder(String template) {
        return RotatingFileAppender.newBuilder("file", tempDir, template)
                .layout(new PatternLayout("{message}"));
    }

    /** 19 characters plus the newline: 20 bytes per line. */
    private static LogRecord line(int n) {
        return LogRecord.of(String.format("line-%014d", n), Level.INFO, "app");
    }

    private static void fill(Path file, int bytes) throws IOException {
        byte[] content = new byte[bytes];
        Arrays.fill(content, (byte) 'x');
        content[bytes - 1] = '\n';
        Files.write(file, content);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should reject a template without {index} before touching the file system")
        void testMissingIndexToken() {
            Path dir = tempDir.resolve("never-created");

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> RotatingFileAppender.newBuilder("file", dir, "app.log").build());

            assertTrue(e.getMessage().contains("{index}"));
            assertFalse(Files.exists(dir));
        }

        @Test
        @DisplayName("Should reject negative sizes and non-positive probe limits")
        void testInvalidLimits() {
            assertThrows(ConfigurationException.class, () -> builder("a_{index}.log").maxSize(-1).build());
            assertThrows(ConfigurationException.class, () -> builder("a_{index}.log").maxProbes(0).build());
        }

        @Test
        @DisplayName("Should reject a zero max size without creating any file")
        void testZeroMaxSize() throws IOException {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> builder("z_{index}.log").maxSize(0).build());

            assertTrue(e.getMessage().contains("max_size"));
            try (Stream<Path> files = Files.list(tempDir)) {
                assertEquals(0, files.count());
            }
        }
    }

    @Nested
    @DisplayName("Size rotation")
    class SizeRotation {

        @Test
        @DisplayName("Should rotate on the sixth 20-byte line with a 100-byte limit")
        void testRotatesAtLimit() throws IOException {
            appender = builder("app_{index}.log").maxSize(100).build();
            appender.start();

            for (int i = 1; i <= 5; i++) {
                assertTrue(appender.append(owner, line(i)));
            }
            assertEquals(tempDir.resolve("app_1.log"), appender.getCurrentPath());
            assertEquals(0, appender.getRotationCount());

            assertTrue(appender.append(owner, line(6)));

            assertEquals(tempDir.resolve("app_2.log"), appender.getCurrentPath());
            assertEquals(1, appender.getRotationCount());
            assertEquals(100, Files.size(tempDir.resolve("app_1.log")));
            assertEquals(List.of("line-00000000000006"), Files.readAllLines(tempDir.resolve("app_2.log")));
            verifyNoInteractions(owner);
        }

        @Test
        @DisplayName("Should rotate before a line that would overflow the file")
        void testPendingLineDoesNotFit() throws IOException {
            appender = builder("app_{index}.log").maxSize(90).build();
            appender.start();

            for (int i = 1; i <= 5; i++) {
                appender.append(owner, line(i));
            }

            assertEquals(80, Files.size(tempDir.resolve("app_1.log")));
            assertEquals(20, Files.size(tempDir.resolve("app_2.log")));
        }

        @Test
        @DisplayName("Should write an oversized line into an empty file")
        void testOversizedLine() throws IOException {
            appender = builder("big_{index}.log").maxSize(10).build();
            appender.start();

            assertTrue(appender.append(owner, line(1)));
            assertTrue(appender.append(owner, line(2)));

            assertEquals(20, Files.size(tempDir.resolve("big_1.log")));
            assertEquals(20, Files.size(tempDir.resolve("big_2.log")));
        }

        @Test
        @DisplayName("Should skip existing files that are already full")
        void testSkipsFullFiles() throws IOException {
            fill(tempDir.resolve("app_1.log"), 100);
            fill(tempDir.resolve("app_2.log"), 120);
            Files.write(tempDir.resolve("app_3.log"), "partial\n".getBytes(StandardCharsets.UTF_8));

            appender = builder("app_{index}.log").maxSize(100).build();
            appender.start();
            appender.append(owner, line(1));

            assertEquals(3, appender.getCurrentIndex());
            assertEquals(List.of("partial", "line-00000000000001"), Files.readAllLines(tempDir.resolve("app_3.log")));
        }
    }

    @Nested
    @DisplayName("Line rotation")
    class LineRotation {

        @Test
        @DisplayName("Should rotate when the line limit is reached")
        void testMaxLines() throws IOException {
            appender = builder("lines_{index}.log").maxLines(3).build();
            appender.start();

            for (int i = 1; i <= 7; i++) {
                appender.append(owner, line(i));
            }

            assertEquals(3, Files.readAllLines(tempDir.resolve("lines_1.log")).size());
            assertEquals(3, Files.readAllLines(tempDir.resolve("lines_2.log")).size());
            assertEquals(1, Files.readAllLines(tempDir.resolve("lines_3.log")).size());
        }

        @Test
        @DisplayName("Should count lines of an existing file")
        void testExistingLines() throws IOException {
            Files.write(tempDir.resolve("lines_1.log"), "a\nb\nc\n".getBytes(StandardCharsets.UTF_8));

            appender = builder("lines_{index}.log").maxLines(3).build();
            appender.start();

            assertEquals(2, appender.getCurrentIndex());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should report probe exhaustion through the owner and drop the record")
        void testProbeExhaustion() throws IOException {
            fill(tempDir.resolve("app_2.log"), 40);
            fill(tempDir.resolve("app_3.log"), 40);
            appender = builder("app_{index}.log").maxSize(40).maxProbes(2).build();
            appender.start();

            assertTrue(appender.append(owner, line(1)));
            assertTrue(appender.append(owner, line(2)));
            assertFalse(appender.append(owner, line(3)));

            verify(owner).reportAppenderFailure(same(appender), contains("No eligible log file"),
                    any(AppenderException.class));
            assertEquals(40, Files.size(tempDir.resolve("app_1.log")));
        }

        @Test
        @DisplayName("Should reject records silently when its own filters say no")
        void testOwnFilters() {
            appender = builder("f_{index}.log").filter(new LevelFilter(Level.ERROR)).build();
            appender.start();

            assertFalse(appender.append(owner, line(1)));
            verifyNoInteractions(owner);
        }

        @Test
        @DisplayName("Should refuse records before start and after stop")
        void testLifecycle() {
            appender = builder("l_{index}.log").build();

            assertFalse(appender.append(owner, line(1)));
            appender.start();
            assertTrue(appender.append(owner, line(2)));
            appender.stop();
            appender.stop();

            assertFalse(appender.append(owner, line(3)));
            assertNull(appender.getCurrentPath());
            assertTrue(appender.getOpenFiles().isEmpty());
        }
    }

    @Test
    @DisplayName("Should substitute date and time tokens from the clock")
    void testDateAndTimeTokens() {
        MutableClock clock = new MutableClock(Instant.parse("2024-02-29T13:45:10Z"), ZoneOffset.UTC);
        appender = builder("app_{date}_{time}_{index}.log").clock(clock).build();
        appender.start();

        assertEquals(tempDir.resolve("app_2024-02-29_13-45-10_1.log"), appender.getCurrentPath());
    }

    @Test
    @DisplayName("Should keep every line intact and within the limit under concurrent writers")
    void testConcurrentWriters() throws Exception {
        appender = builder("conc_{index}.log").maxSize(4096).build();
        appender.start();

        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int base = t * perThread;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    assertTrue(appender.append(owner, line(base + i)));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();
        appender.stop();

        List<Path> files;
        try (Stream<Path> stream = Files.list(tempDir)) {
            files = stream.filter(p -> p.getFileName().toString().startsWith("conc_")).collect(Collectors.toList());
        }
        Set<String> seen = new HashSet<>();
        for (Path file : files) {
            assertTrue(Files.size(file) <= 4096, file + " exceeds the limit");
            for (String l : Files.readAllLines(file)) {
                assertTrue(l.matches("line-\\d{14}"), "corrupted line: " + l);
                seen.add(l);
            }
        }
        assertEquals(threads * perThread, seen.size());
        verifyNoInteractions(owner);
    }
}
