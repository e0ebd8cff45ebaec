package ph.extremelogic.common.treelog;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Static access to a process-wide default {@link LoggerRegistry}. The registry is
 * created on first use. A single JVM shutdown hook, installed with the first registry,
 * shuts down whichever registry is current at exit.
 */
public final class LogManager {
    private static final AtomicBoolean initialized = new AtomicBoolean(false);
    private static final AtomicBoolean hookInstalled = new AtomicBoolean(false);
    private static final Thread SHUTDOWN_HOOK = new Thread(LogManager::shutdown, "treelog-shutdown");
    private static volatile LoggerRegistry registry;

    private LogManager() {
    }

    public static LoggerRegistry getRegistry() {
        if (!initialized.get()) {
            initialize(new LoggerRegistry());
        }
        return registry;
    }

    /**
     * Installs {@code custom} as the default registry. Has no effect once a default
     * registry exists.
     *
     * @return {@code true} if {@code custom} was installed
     */
    public static boolean initialize(LoggerRegistry custom) {
        synchronized (LogManager.class) {
            if (initialized.get()) {
                return false;
            }
            registry = custom;
            initialized.set(true);
        }
        if (hookInstalled.compareAndSet(false, true)) {
            Runtime.getRuntime().addShutdownHook(SHUTDOWN_HOOK);
        }
        return true;
    }

    static Thread getShutdownHook() {
        return SHUTDOWN_HOOK;
    }

    public static Logger getLogger(String name) {
        return getRegistry().getLogger(name);
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Logger getRootLogger() {
        return getRegistry().getRootLogger();
    }

    public static Logger.Builder newLogger(String name) {
        return getRegistry().newLogger(name);
    }

    /**
     * Shuts the default registry down. A later call to any accessor starts a fresh one.
     */
    public static void shutdown() {
        LoggerRegistry current;
        synchronized (LogManager.class) {
            if (!initialized.compareAndSet(true, false)) {
                return;
            }
            current = registry;
            registry = null;
        }
        try {
            current.shutdown();
        } catch (RuntimeException e) {
            StatusLogger.error("Critical error during shutdown: " + e.getMessage(), e);
        }
    }
}
