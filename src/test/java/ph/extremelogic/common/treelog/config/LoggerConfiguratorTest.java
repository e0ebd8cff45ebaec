package ph.extremelogic.common.treelog.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.LoggerRegistry;
import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.appender.*;
import ph.extremelogic.common.treelog.filter.*;
import ph.extremelogic.common.treelog.layout.JsonLayout;
import ph.extremelogic.common.treelog.layout.PatternLayout;
import ph.extremelogic.common.treelog.layout.YamlLayout;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class LoggerConfiguratorTest {

    @TempDir
    Path tempDir;

    private LoggerRegistry registry;
    private LoggerConfigurator configurator;

    @BeforeEach
    void setUp() {
        registry = new LoggerRegistry();
        configurator = new LoggerConfigurator(registry);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @Nested
    @DisplayName("configure")
    class Configure {

        @Test
        @DisplayName("Should build a logger with formatter, filters and handlers")
        void testFullConfig() {
            Map<String, Object> config = map(
                    "name", "App.DB",
                    "level", "debug",
                    "prefix", "DB",
                    "propagate", "false",
                    "formatter", map("type", "default", "format", "{level_name}: {message}", "time_format", "HH:mm"),
                    "filters", List.of(
                            map("type", "level", "level", "INFO"),
                            map("type", "composite", "mode", "OR", "filters", List.of(
                                    map("type", "regex", "pattern", "sql", "invert", true),
                                    map("type", "module", "module_name", "app.db")))),
                    "handlers", List.of(
                            map("type", "stream", "colored", false),
                            map("type", "file", "file_directory", tempDir.toString(), "file_name", "db_{index}.log",
                                    "max_size", "2048", "max_lines", 100, "max_probes", 50),
                            map("type", "size_rotating_file", "file_directory", tempDir.toString(),
                                    "file_name", "db.log", "max_size", 4096, "backup_count", 2),
                            map("type", "timed_rotating_file", "file_directory", tempDir.toString(),
                                    "file_name", "db-timed.log", "when", "H", "interval", 6, "backup_count", 3)));

            Logger logger = configurator.configure(config);

            assertEquals("app.db", logger.getName());
            assertSame(Level.DEBUG, logger.getLevel());
            assertEquals("DB", logger.getPrefix());
            assertFalse(logger.isPropagate());
            assertEquals("{level_name}: {message}", ((PatternLayout) logger.getLayout()).getPattern());
            assertEquals(2, logger.getFilters().size());
            assertTrue(logger.getFilters().get(1) instanceof CompositeFilter);

            List<Appender> appenders = logger.getAppenders();
            assertEquals(4, appenders.size());
            assertTrue(appenders.get(0) instanceof ConsoleAppender);
            RotatingFileAppender file = (RotatingFileAppender) appenders.get(1);
            assertEquals(2048, file.getMaxSize());
            assertEquals(100, file.getMaxLines());
            assertEquals(50, file.getMaxProbes());
            assertEquals(tempDir.resolve("db_1.log"), file.getCurrentPath());
            assertEquals(2, ((SizeRotatingFileAppender) appenders.get(2)).getBackupCount());
            TimedRotatingFileAppender timed = (TimedRotatingFileAppender) appenders.get(3);
            assertEquals(TimedRotatingFileAppender.When.HOURS, timed.getWhen());
            assertEquals(6, timed.getInterval());
            assertTrue(appenders.stream().allMatch(Appender::isStarted));
            assertSame(logger, registry.find("app.db"));
        }

        @Test
        @DisplayName("Should read tags, category and filter inheritance")
        void testTagsCategoryInheritance() {
            Logger logger = configurator.configure(map("name", "tagged", "tags", List.of("billing", "eu"),
                    "category", "audit", "inherit_filters", "false"));

            assertEquals(List.of("billing", "eu"), logger.getTags());
            assertEquals("audit", logger.getCategory());
            assertFalse(logger.isInheritFilters());

            configurator.apply(logger, map("tags", List.of("vip"), "inherit_filters", true));
            assertEquals(List.of("billing", "eu", "vip"), logger.getTags());
            assertEquals("audit", logger.getCategory());
            assertTrue(logger.isInheritFilters());
        }

        @Test
        @DisplayName("Should use defaults for a minimal config")
        void testMinimal() {
            Logger logger = configurator.configure(map("name", "minimal"));

            assertSame(Level.NOTSET, logger.getLevel());
            assertTrue(logger.isPropagate());
            assertTrue(logger.isEnabled());
            assertTrue(logger.getAppenders().isEmpty());
            assertTrue(logger.getTags().isEmpty());
            assertNull(logger.getCategory());
            assertTrue(logger.isInheritFilters());
        }

        @ParameterizedTest
        @ValueSource(strings = {"json", "xml", "yaml", "csv", "html", "markdown"})
        @DisplayName("Should accept every structured formatter type")
        void testFormatterTypes(String type) {
            Logger logger = configurator.configure(map("name", "fmt-" + type, "formatter", map("type", type)));
            assertEquals(type, logger.getLayout().getClass().getSimpleName().replace("Layout", "").toLowerCase(Locale.ROOT));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Should require a name")
        void testMissingName() {
            assertThrows(ConfigurationException.class, () -> configurator.configure(map("level", "INFO")));
        }

        @Test
        @DisplayName("Should refuse a name already registered")
        void testDuplicateName() {
            configurator.configure(map("name", "dup"));
            assertThrows(ConfigurationException.class, () -> configurator.configure(map("name", "DUP")));
        }

        @Test
        @DisplayName("Should reject unknown types and levels")
        void testUnknowns() {
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "a", "level", "LOUD")));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "b", "formatter", map("type", "protobuf"))));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "c", "filters", List.of(map("type", "geo")))));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "d", "handlers", List.of(map("type", "syslog")))));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "e", "handlers",
                            List.of(map("type", "timed_rotating_file", "file_directory", tempDir.toString(), "when", "W")))));
        }

        @Test
        @DisplayName("Should reject missing required keys and malformed values")
        void testMissingKeys() {
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "a", "filters", List.of(map("type", "regex")))));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "b", "filters", List.of(map("type", "time", "start_time", "08:00")))));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "c", "handlers",
                            List.of(map("type", "file", "file_directory", tempDir.toString(), "max_size", "ten")))));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "d", "handlers",
                            List.of(map("type", "file", "file_directory", tempDir.toString(), "file_name", "no-index.log")))));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "e", "propagate", "maybe")));
            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "f", "filters", "level")));
        }

        @Test
        @DisplayName("Should require a compressor when compression is requested")
        void testCompressWithoutCompressor() {
            Map<String, Object> handler = map("type", "size_rotating_file", "file_directory", tempDir.toString(),
                    "max_size", 100, "compress", true);

            assertThrows(ConfigurationException.class,
                    () -> configurator.configure(map("name", "zip", "handlers", List.of(handler))));

            LoggerConfigurator withCompressor = new LoggerConfigurator(registry, mock(Compressor.class));
            Logger logger = withCompressor.configure(map("name", "zip", "handlers", List.of(handler)));
            assertEquals(1, logger.getAppenders().size());
        }

        @Test
        @DisplayName("Should release handlers already started when a later one cannot start")
        void testHandlerStartFailure() throws Exception {
            Path blocker = Files.createFile(tempDir.resolve("blocker"));
            Map<String, Object> good = map("type", "file", "file_directory", tempDir.toString(), "file_name", "c_{index}.log");
            Map<String, Object> bad = map("type", "file", "file_directory", blocker.toString(), "file_name", "d_{index}.log");

            assertThrows(UncheckedIOException.class,
                    () -> configurator.configure(map("name", "leaky", "handlers", List.of(good, bad))));
            assertNull(registry.find("leaky"));

            Logger retry = configurator.configure(map("name", "leaky", "handlers", List.of(good)));
            RotatingFileAppender appender = (RotatingFileAppender) retry.getAppenders().get(0);
            assertEquals(tempDir.resolve("c_1.log"), appender.getCurrentPath());
        }

        @Test
        @DisplayName("Should leave an existing logger unchanged when a new handler cannot start")
        void testApplyHandlerStartFailure() throws Exception {
            Path blocker = Files.createFile(tempDir.resolve("blocker"));
            Logger logger = registry.newLogger("steady").level(Level.INFO).create();

            assertThrows(UncheckedIOException.class, () -> configurator.apply(logger, map("level", "DEBUG",
                    "handlers", List.of(
                            map("type", "file", "file_directory", tempDir.toString(), "file_name", "s_{index}.log"),
                            map("type", "file", "file_directory", blocker.toString(), "file_name", "t_{index}.log")))));

            assertSame(Level.INFO, logger.getLevel());
            assertTrue(logger.getAppenders().isEmpty());
        }

        @Test
        @DisplayName("Should leave the registry untouched when a config is invalid")
        void testNoPartialRegistration() {
            assertThrows(ConfigurationException.class, () -> configurator.configure(map("name", "partial",
                    "handlers", List.of(map("type", "stream"), map("type", "bogus")))));

            assertNull(registry.find("partial"));
        }
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("Should update only the settings present")
        void testApply() {
            Logger logger = registry.newLogger("live").level(Level.INFO).prefix("LIVE").create();

            configurator.apply(logger, map("level", "ERROR", "formatter", map("type", "json"),
                    "filters", List.of(map("type", "time", "start_time", "00:00", "end_time", "23:59:59"))));

            assertSame(Level.ERROR, logger.getLevel());
            assertEquals("LIVE", logger.getPrefix());
            assertTrue(logger.getLayout() instanceof JsonLayout);
            assertTrue(logger.getFilters().get(0) instanceof TimeFilter);
            assertTrue(logger.isPropagate());
        }

        @Test
        @DisplayName("Should apply nothing when the update is invalid")
        void testApplyInvalid() {
            Logger logger = registry.newLogger("stable").level(Level.INFO).create();

            assertThrows(ConfigurationException.class,
                    () -> configurator.apply(logger, map("level", "DEBUG", "formatter", map("type", "yaml"),
                            "filters", List.of(map("type", "level")))));

            assertSame(Level.INFO, logger.getLevel());
            assertFalse(logger.getLayout() instanceof YamlLayout);
        }
    }
}
