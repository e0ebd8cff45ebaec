package ph.extremelogic.common.treelog;

import ph.extremelogic.common.treelog.api.Level;
import ph.extremelogic.common.treelog.appender.Appender;
import ph.extremelogic.common.treelog.appender.ConsoleAppender;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns a tree of loggers. Names are case-insensitive and unique within a registry.
 * The root logger is created on first use.
 */
public final class LoggerRegistry {
    public static final String ROOT_LOGGER_NAME = "root";
    public static final String ROOT_PREFIX = "ROOT";

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile Logger root;
    private volatile AsyncLogProcessor asyncProcessor;

    /**
     * Starts building a new logger. {@link Logger.Builder#create()} fails if the name
     * is taken.
     */
    public Logger.Builder newLogger(String name) {
        return new Logger.Builder(this, normalize(name));
    }

    Logger register(Logger.Builder builder) {
        synchronized (creationLock) {
            String name = builder.getName();
            if (ROOT_LOGGER_NAME.equals(name) || loggers.containsKey(name)) {
                throw new ConfigurationException("Logger '" + name + "' already exists");
            }
            Logger parent = builder.resolveParent();
            if (parent == null) {
                parent = getRootLogger();
            }
            if (parent.getRegistry() != this) {
                throw new ConfigurationException("Parent of '" + name + "' belongs to another registry");
            }
            Logger logger = new Logger(this, builder, parent);
            parent.addChild(logger);
            loggers.put(name, logger);
            return logger;
        }
    }

    /**
     * Returns the logger with this dotted name, creating it and any missing ancestor
     * ({@code a}, {@code a.b}, ...) with default settings.
     */
    public Logger getLogger(String name) {
        String normalized = normalize(name);
        if (ROOT_LOGGER_NAME.equals(normalized)) {
            return getRootLogger();
        }
        Logger existing = loggers.get(normalized);
        if (existing != null) {
            return existing;
        }
        synchronized (creationLock) {
            existing = loggers.get(normalized);
            if (existing != null) {
                return existing;
            }
            int dot = normalized.lastIndexOf('.');
            Logger parent = dot > 0 ? getLogger(normalized.substring(0, dot)) : getRootLogger();
            return newLogger(normalized).parent(parent).create();
        }
    }

    public Logger getRootLogger() {
        Logger r = root;
        if (r != null) {
            return r;
        }
        synchronized (creationLock) {
            if (root == null) {
                Logger.Builder builder = new Logger.Builder(this, ROOT_LOGGER_NAME)
                        .prefix(ROOT_PREFIX)
                        .level(Level.INFO)
                        .propagate(false)
                        .appender(new ConsoleAppender("console"));
                Logger created = new Logger(this, builder, null);
                loggers.put(ROOT_LOGGER_NAME, created);
                root = created;
            }
            return root;
        }
    }

    /**
     * @return the logger, or {@code null} if none has this name
     */
    public Logger find(String name) {
        String normalized = normalize(name);
        if (ROOT_LOGGER_NAME.equals(normalized)) {
            return getRootLogger();
        }
        return loggers.get(normalized);
    }

    public boolean contains(String name) {
        return find(name) != null;
    }

    public Collection<Logger> getLoggers() {
        return Collections.unmodifiableCollection(new ArrayList<>(loggers.values()));
    }

    /**
     * The processor behind {@link Logger#logAsync}, started on first use.
     */
    public AsyncLogProcessor getAsyncProcessor() {
        AsyncLogProcessor p = asyncProcessor;
        if (p != null) {
            return p;
        }
        synchronized (creationLock) {
            if (asyncProcessor == null) {
                AsyncLogProcessor created = new AsyncLogProcessor();
                if (shutdown.get()) {
                    created.shutdown();
                } else {
                    created.start();
                }
                asyncProcessor = created;
            }
            return asyncProcessor;
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Drains the async processor, then stops every distinct appender of every logger
     * once. Later calls do nothing.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        AsyncLogProcessor p = asyncProcessor;
        if (p != null) {
            p.shutdown();
        }

        Set<Appender> stopped = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Logger> all = new ArrayList<>(loggers.values());
        for (Logger logger : all) {
            for (Appender appender : logger.getAppenders()) {
                if (!stopped.add(appender)) {
                    continue;
                }
                try {
                    appender.stop();
                } catch (RuntimeException e) {
                    StatusLogger.error("Error stopping appender " + appender.getName()
                            + " of logger " + logger.getName(), e);
                }
            }
        }
    }

    static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Logger name must not be blank");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
