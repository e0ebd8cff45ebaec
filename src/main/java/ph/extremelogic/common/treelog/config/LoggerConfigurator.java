package ph.extremelogic.common.treelog.config;

import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.Logger;
import ph.extremelogic.common.treelog.LoggerRegistry;
import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.appender.Appender;
import ph.extremelogic.common.treelog.appender.Compressor;
import ph.extremelogic.common.treelog.appender.ConsoleAppender;
import ph.extremelogic.common.treelog.appender.RotatingFileAppender;
import ph.extremelogic.common.treelog.appender.SizeRotatingFileAppender;
import ph.extremelogic.common.treelog.appender.TimedRotatingFileAppender;
import ph.extremelogic.common.treelog.filter.CompositeFilter;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.filter.LevelFilter;
import ph.extremelogic.common.treelog.filter.ModuleFilter;
import ph.extremelogic.common.treelog.filter.RegexFilter;
import ph.extremelogic.common.treelog.filter.TimeFilter;
import ph.extremelogic.common.treelog.layout.CsvLayout;
import ph.extremelogic.common.treelog.layout.HtmlLayout;
import ph.extremelogic.common.treelog.layout.JsonLayout;
import ph.extremelogic.common.treelog.layout.Layout;
import ph.extremelogic.common.treelog.layout.MarkdownLayout;
import ph.extremelogic.common.treelog.layout.PatternLayout;
import ph.extremelogic.common.treelog.layout.XmlLayout;
import ph.extremelogic.common.treelog.layout.YamlLayout;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static ph.extremelogic.common.treelog.config.ConfigValues.getBoolean;
import static ph.extremelogic.common.treelog.config.ConfigValues.getInt;
import static ph.extremelogic.common.treelog.config.ConfigValues.getLevel;
import static ph.extremelogic.common.treelog.config.ConfigValues.getLong;
import static ph.extremelogic.common.treelog.config.ConfigValues.getMap;
import static ph.extremelogic.common.treelog.config.ConfigValues.getMapList;
import static ph.extremelogic.common.treelog.config.ConfigValues.getString;
import static ph.extremelogic.common.treelog.config.ConfigValues.getStringList;
import static ph.extremelogic.common.treelog.config.ConfigValues.getTime;
import static ph.extremelogic.common.treelog.config.ConfigValues.requireString;

/**
 * Builds loggers from an already-parsed configuration map (keys as in a JSON or YAML
 * logging config: {@code name}, {@code level}, {@code prefix}, {@code propagate},
 * {@code enabled}, {@code inherit_filters}, {@code category}, {@code tags},
 * {@code formatter}, {@code filters}, {@code handlers}).
 *
 * <p>Every element is validated and built before the logger is touched, so an invalid
 * map leaves the registry and the logger unchanged. Handlers that were started before
 * another handler failed to start are stopped again.</p>
 */
public class LoggerConfigurator {
    public static final String DEFAULT_DIRECTORY = "logs";

    private final LoggerRegistry registry;
    private final Compressor compressor;

    public LoggerConfigurator(LoggerRegistry registry) {
        this(registry, null);
    }

    /**
     * @param compressor used by handlers with {@code compress: true}; may be {@code null}
     */
    public LoggerConfigurator(LoggerRegistry registry, Compressor compressor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.compressor = compressor;
    }

    /**
     * Creates and registers a new logger described by {@code config}.
     *
     * @throws ConfigurationException on a missing name, a taken name or any invalid entry
     */
    public Logger configure(Map<String, ?> config) {
        String name = requireString(config, "name", "logger config");
        if (registry.find(name) != null) {
            throw new ConfigurationException("Logger '" + name + "' already exists");
        }
        Level level = getLevel(config, "level");
        Layout layout = createLayout(getMap(config, "formatter"));
        List<Filter> filters = createFilters(getMapList(config, "filters"));
        List<Appender> appenders = createAppenders(getMapList(config, "handlers"));

        Logger.Builder builder = registry.newLogger(name)
                .propagate(getBoolean(config, "propagate", true))
                .enabled(getBoolean(config, "enabled", true))
                .inheritFilters(getBoolean(config, "inherit_filters", true))
                .category(getString(config, "category", null))
                .tags(getStringList(config, "tags"))
                .filters(filters)
                .appenders(appenders);
        if (config.containsKey("parent")) {
            builder.parent(getString(config, "parent", null));
        }
        if (level != null) {
            builder.level(level);
        }
        if (config.containsKey("prefix")) {
            builder.prefix(getString(config, "prefix", null));
        }
        if (layout != null) {
            builder.layout(layout);
        }
        return builder.create();
    }

    /**
     * Updates an existing logger. Keys that are absent leave the setting unchanged;
     * filters, handlers and tags are added to the existing ones. Handlers are started
     * first, so a handler that fails to start leaves the logger unchanged.
     */
    public void apply(Logger logger, Map<String, ?> config) {
        Level level = getLevel(config, "level");
        Layout layout = createLayout(getMap(config, "formatter"));
        List<Filter> filters = createFilters(getMapList(config, "filters"));
        List<Appender> appenders = createAppenders(getMapList(config, "handlers"));
        boolean propagate = getBoolean(config, "propagate", logger.isPropagate());
        boolean enabled = getBoolean(config, "enabled", logger.isEnabled());
        boolean inheritFilters = getBoolean(config, "inherit_filters", logger.isInheritFilters());
        List<String> tags = getStringList(config, "tags");

        logger.addAppenders(appenders);
        if (level != null) {
            logger.setLevel(level);
        }
        if (config.containsKey("prefix")) {
            logger.setPrefix(getString(config, "prefix", null));
        }
        if (layout != null) {
            logger.setLayout(layout);
        }
        logger.setPropagate(propagate);
        logger.setEnabled(enabled);
        for (Filter filter : filters) {
            logger.addFilter(filter);
        }
        logger.setInheritFilters(inheritFilters);
        if (config.containsKey("category")) {
            logger.setCategory(getString(config, "category", null));
        }
        for (String tag : tags) {
            logger.addTag(tag);
        }
    }

    // ---- formatters ---------------------------------------------------------------

    Layout createLayout(Map<String, ?> config) {
        if (config == null) {
            return null;
        }
        String type = getString(config, "type", "default").toLowerCase(Locale.ROOT);
        switch (type) {
            case "default":
            case "pattern":
                return new PatternLayout(
                        getString(config, "format", PatternLayout.DEFAULT_PATTERN),
                        getString(config, "time_format", PatternLayout.DEFAULT_TIME_PATTERN));
            case "json":
                return new JsonLayout();
            case "xml":
                return new XmlLayout();
            case "yaml":
                return new YamlLayout();
            case "csv":
                return new CsvLayout();
            case "html":
                return new HtmlLayout();
            case "markdown":
                return new MarkdownLayout();
            default:
                throw new ConfigurationException("Unknown formatter type: " + type);
        }
    }

    // ---- filters --------------------------------------------------------------------

    List<Filter> createFilters(List<Map<String, Object>> configs) {
        List<Filter> filters = new ArrayList<>(configs.size());
        for (Map<String, Object> config : configs) {
            filters.add(createFilter(config));
        }
        return filters;
    }

    Filter createFilter(Map<String, ?> config) {
        String type = requireString(config, "type", "filter config").toLowerCase(Locale.ROOT);
        switch (type) {
            case "level":
                Level level = getLevel(config, "level");
                if (level == null) {
                    throw new ConfigurationException("Missing required key 'level' in level filter");
                }
                return new LevelFilter(level);
            case "regex":
                return new RegexFilter(requireString(config, "pattern", "regex filter"),
                        getBoolean(config, "invert", false));
            case "time":
                return new TimeFilter(getTime(config, "start_time", "time filter"),
                        getTime(config, "end_time", "time filter"));
            case "module":
                return new ModuleFilter(requireString(config, "module_name", "module filter"));
            case "composite":
                String mode = getString(config, "mode", "AND");
                if (CompositeFilter.Mode.forName(mode) == null) {
                    throw new ConfigurationException("Unknown composite mode: " + mode);
                }
                return new CompositeFilter(createFilters(getMapList(config, "filters")), mode);
            default:
                throw new ConfigurationException("Unknown filter type: " + type);
        }
    }

    // ---- handlers -------------------------------------------------------------------

    List<Appender> createAppenders(List<Map<String, Object>> configs) {
        List<Appender> appenders = new ArrayList<>(configs.size());
        for (int i = 0; i < configs.size(); i++) {
            appenders.add(createAppender(configs.get(i), i));
        }
        return appenders;
    }

    Appender createAppender(Map<String, ?> config, int position) {
        String type = requireString(config, "type", "handler config").toLowerCase(Locale.ROOT);
        String name = getString(config, "name", type + "-" + position);
        Layout layout = createLayout(getMap(config, "formatter"));
        List<Filter> filters = createFilters(getMapList(config, "filters"));
        Path directory = Paths.get(getString(config, "file_directory", DEFAULT_DIRECTORY));

        switch (type) {
            case "stream":
                return new ConsoleAppender(name, layout, null, getBoolean(config, "colored", true), filters);
            case "file":
                return RotatingFileAppender.newBuilder(name, directory, getString(config, "file_name", "app_{index}.log"))
                        .layout(layout)
                        .filters(filters)
                        .maxSize(getLong(config, "max_size", RotatingFileAppender.DEFAULT_MAX_SIZE))
                        .maxLines(getLong(config, "max_lines", 0))
                        .maxProbes(getInt(config, "max_probes", RotatingFileAppender.DEFAULT_MAX_PROBES))
                        .build();
            case "size_rotating_file":
                return SizeRotatingFileAppender.newBuilder(name, directory, getString(config, "file_name", "app.log"))
                        .layout(layout)
                        .filters(filters)
                        .maxSize(getLong(config, "max_size", RotatingFileAppender.DEFAULT_MAX_SIZE))
                        .backupCount(getInt(config, "backup_count", 5))
                        .compressor(resolveCompressor(config, name))
                        .build();
            case "timed_rotating_file":
                String when = getString(config, "when", "D");
                TimedRotatingFileAppender.When unit = TimedRotatingFileAppender.When.forCode(when);
                if (unit == null) {
                    throw new ConfigurationException("Unknown rotation unit for handler " + name + ": " + when);
                }
                return TimedRotatingFileAppender.newBuilder(name, directory, getString(config, "file_name", "app.log"))
                        .layout(layout)
                        .filters(filters)
                        .when(unit)
                        .interval(getInt(config, "interval", 1))
                        .backupCount(getInt(config, "backup_count", 5))
                        .maxSize(getLong(config, "max_size", 0))
                        .compressor(resolveCompressor(config, name))
                        .build();
            default:
                throw new ConfigurationException("Unknown handler type: " + type);
        }
    }

    private Compressor resolveCompressor(Map<String, ?> config, String handlerName) {
        if (!getBoolean(config, "compress", false)) {
            return null;
        }
        if (compressor == null) {
            throw new ConfigurationException("Handler " + handlerName + " requests compression but no compressor is configured");
        }
        return compressor;
    }
}
