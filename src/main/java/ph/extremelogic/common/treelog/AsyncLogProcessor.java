package ph.extremelogic.common.treelog;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs logger dispatch on a single consumer thread fed by a Disruptor ring buffer.
 * Producers may publish from any thread; records of one producer are dispatched in the
 * order they were submitted.
 */
public final class AsyncLogProcessor {
    static final int RING_BUFFER_SIZE = 16384; // power of 2
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 3;

    private final Disruptor<LogEvent> disruptor;
    private final RingBuffer<LogEvent> ringBuffer;
    private final AtomicLong publishedEvents = new AtomicLong();
    private final AtomicLong processedEvents = new AtomicLong();

    // Read lock for publishing, write lock to flip the shutdown flag, so that every
    // event accepted before shutdown is drained
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private boolean started;
    private boolean shutdown;

    AsyncLogProcessor() {
        this.disruptor = new Disruptor<>(
                LogEvent::new,
                RING_BUFFER_SIZE,
                r -> {
                    Thread t = new Thread(r, "treelog-async");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((thread, ex) ->
                            StatusLogger.error("Async log processor thread error: " + ex.getMessage(), ex));
                    return t;
                },
                ProducerType.MULTI,
                new SleepingWaitStrategy());
        disruptor.handleEventsWith(new LogEventHandler());
        this.ringBuffer = disruptor.getRingBuffer();
    }

    void start() {
        stateLock.writeLock().lock();
        try {
            if (!started && !shutdown) {
                disruptor.start();
                started = true;
            }
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /**
     * Queues the record for dispatch through {@code logger}. Blocks while the ring
     * buffer is full.
     *
     * @return a future completed with the dispatch result; {@code false} at once if
     *         the processor is shut down
     */
    CompletableFuture<Boolean> submit(Logger logger, LogRecord record) {
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        stateLock.readLock().lock();
        try {
            if (shutdown || !started) {
                future.complete(Boolean.FALSE);
                return future;
            }
            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).set(logger, record, future);
                publishedEvents.incrementAndGet();
            } finally {
                ringBuffer.publish(sequence);
            }
        } finally {
            stateLock.readLock().unlock();
        }
        return future;
    }

    /**
     * Stops accepting records, waits for queued ones to be dispatched and stops the
     * consumer thread. Later calls do nothing.
     */
    void shutdown() {
        stateLock.writeLock().lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            if (!started) {
                return;
            }
        } finally {
            stateLock.writeLock().unlock();
        }

        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            StatusLogger.warn("Async log processor did not drain within "
                    + SHUTDOWN_TIMEOUT_SECONDS + "s, halting with " + getPendingEventCount() + " pending");
            disruptor.halt();
        }
    }

    public boolean isShutdown() {
        stateLock.readLock().lock();
        try {
            return shutdown;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public long getPendingEventCount() {
        return publishedEvents.get() - processedEvents.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    static final class LogEvent {
        private Logger logger;
        private LogRecord record;
        private CompletableFuture<Boolean> future;

        void set(Logger logger, LogRecord record, CompletableFuture<Boolean> future) {
            this.logger = logger;
            this.record = record;
            this.future = future;
        }

        void clear() {
            logger = null;
            record = null;
            future = null;
        }
    }

    private final class LogEventHandler implements EventHandler<LogEvent> {
        @Override
        public void onEvent(LogEvent event, long sequence, boolean endOfBatch) {
            CompletableFuture<Boolean> future = event.future;
            try {
                future.complete(event.logger.process(event.record));
            } catch (RuntimeException e) {
                StatusLogger.error("Async dispatch failed for logger " + event.logger.getName(), e);
                future.completeExceptionally(e);
            } finally {
                event.clear();
                processedEvents.incrementAndGet();
            }
        }
    }
}
