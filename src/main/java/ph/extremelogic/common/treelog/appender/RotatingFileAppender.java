package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.AppenderException;
import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.layout.Layout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Appends to a numbered series of files and moves on to the next eligible file when
 * the current one reaches its size or line limit.
 *
 * <p>File names come from a template that must contain {@code {index}} and may
 * contain {@code {date}} ({@code yyyy-MM-dd}) and {@code {time}} ({@code HH-mm-ss}).
 * Candidates are probed from index 1 upwards; a candidate is created if absent and
 * adopted when it is below both limits and the pending line still fits. A line longer
 * than {@code maxSize} is written to an empty file rather than dropped.</p>
 */
public final class RotatingFileAppender extends AbstractFileAppender {
    public static final String INDEX_TOKEN = "{index}";
    public static final String DATE_TOKEN = "{date}";
    public static final String TIME_TOKEN = "{time}";
    public static final int DEFAULT_MAX_PROBES = 10_000;
    public static final long DEFAULT_MAX_SIZE = 10 * 1024 * 1024L; // 10MB

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH-mm-ss");

    private final Path directory;
    private final String fileNameTemplate;
    private final long maxSize;
    private final long maxLines;
    private final int maxProbes;
    private final Clock clock;

    // Guarded by lock
    private final Map<Path, LogFile> openFiles = new HashMap<>();
    private int currentIndex;
    private int rotations;

    private RotatingFileAppender(Builder builder) {
        super(builder.name, builder.layout, builder.filters);
        if (builder.fileNameTemplate == null || !builder.fileNameTemplate.contains(INDEX_TOKEN)) {
            throw new ConfigurationException("File name template must contain " + INDEX_TOKEN
                    + ": " + builder.fileNameTemplate);
        }
        if (builder.maxSize <= 0) {
            throw new ConfigurationException("max_size must be positive: " + builder.maxSize);
        }
        if (builder.maxProbes < 1) {
            throw new ConfigurationException("max_probes must be positive: " + builder.maxProbes);
        }
        this.directory = Objects.requireNonNull(builder.directory, "directory");
        this.fileNameTemplate = builder.fileNameTemplate;
        this.maxSize = builder.maxSize;
        this.maxLines = builder.maxLines;
        this.maxProbes = builder.maxProbes;
        this.clock = builder.clock;
    }

    public static Builder newBuilder(String name, Path directory, String fileNameTemplate) {
        return new Builder(name, directory, fileNameTemplate);
    }

    @Override
    protected void onStart() {
        lock.lock();
        try {
            current = selectFile(1, 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start RotatingFileAppender: " + getName(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected LogFile prepare(int pendingBytes) throws IOException {
        if (current == null || !current.isOpen()) {
            // Re-open after a failed write, starting from the index we were on
            current = selectFile(Math.max(currentIndex, 1), pendingBytes);
        } else if (isOverLimit(current, pendingBytes)) {
            LogFile retired = current;
            current = selectFile(currentIndex + 1, pendingBytes);
            rotations++;
            openFiles.remove(retired.path());
            closeQuietly(retired);
        }
        return current;
    }

    private boolean isOverLimit(LogFile file, int pendingBytes) {
        return !isEligible(file.size(), file.lines(), pendingBytes);
    }

    private boolean isEligible(long size, long lines, int pendingBytes) {
        if (size >= maxSize) {
            return false;
        }
        if (size > 0 && size + pendingBytes > maxSize) {
            return false;
        }
        return maxLines <= 0 || lines < maxLines;
    }

    /**
     * Linear candidate search starting at {@code fromIndex}, bounded by {@code maxProbes}.
     */
    private LogFile selectFile(int fromIndex, int pendingBytes) throws IOException {
        for (int probe = 0; probe < maxProbes; probe++) {
            int index = fromIndex + probe;
            Path candidate = resolve(index);
            LogFile file = openFiles.get(candidate);
            if (file == null || !file.isOpen()) {
                file = LogFile.open(candidate);
                openFiles.put(candidate, file);
            }
            if (isEligible(file.size(), file.lines(), pendingBytes)) {
                currentIndex = index;
                return file;
            }
            if (file != current) {
                openFiles.remove(candidate);
                closeQuietly(file);
            }
        }
        throw new AppenderException("No eligible log file found after " + maxProbes
                + " candidates from index " + fromIndex + " for template " + fileNameTemplate);
    }

    Path resolve(int index) {
        String name = fileNameTemplate.replace(INDEX_TOKEN, Integer.toString(index));
        if (name.contains(DATE_TOKEN) || name.contains(TIME_TOKEN)) {
            LocalDateTime now = LocalDateTime.now(clock);
            name = name.replace(DATE_TOKEN, now.format(DATE_FORMAT))
                    .replace(TIME_TOKEN, now.format(TIME_FORMAT));
        }
        return directory.resolve(name);
    }

    @Override
    protected void onStop() {
        lock.lock();
        try {
            for (Iterator<LogFile> it = openFiles.values().iterator(); it.hasNext(); ) {
                closeQuietly(it.next());
                it.remove();
            }
            current = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Path of the file currently written to, or {@code null} before start and after stop.
     */
    public Path getCurrentPath() {
        lock.lock();
        try {
            return current != null ? current.path() : null;
        } finally {
            lock.unlock();
        }
    }

    public int getCurrentIndex() {
        lock.lock();
        try {
            return currentIndex;
        } finally {
            lock.unlock();
        }
    }

    public int getRotationCount() {
        lock.lock();
        try {
            return rotations;
        } finally {
            lock.unlock();
        }
    }

    public List<Path> getOpenFiles() {
        lock.lock();
        try {
            return new ArrayList<>(openFiles.keySet());
        } finally {
            lock.unlock();
        }
    }

    public Path getDirectory() { return directory; }
    public String getFileNameTemplate() { return fileNameTemplate; }
    public long getMaxSize() { return maxSize; }
    public long getMaxLines() { return maxLines; }
    public int getMaxProbes() { return maxProbes; }

    public static final class Builder {
        private final String name;
        private final Path directory;
        private final String fileNameTemplate;
        private Layout layout;
        private final List<Filter> filters = new ArrayList<>();
        private long maxSize = DEFAULT_MAX_SIZE;
        private long maxLines = 0;
        private int maxProbes = DEFAULT_MAX_PROBES;
        private Clock clock = Clock.systemDefaultZone();

        private Builder(String name, Path directory, String fileNameTemplate) {
            this.name = name;
            this.directory = directory != null ? directory : Paths.get("logs");
            this.fileNameTemplate = fileNameTemplate;
        }

        public Builder layout(Layout layout) {
            this.layout = layout;
            return this;
        }

        public Builder filter(Filter filter) {
            this.filters.add(filter);
            return this;
        }

        public Builder filters(List<? extends Filter> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        /**
         * Line limit per file; zero or negative disables it.
         */
        public Builder maxLines(long maxLines) {
            this.maxLines = maxLines;
            return this;
        }

        public Builder maxProbes(int maxProbes) {
            this.maxProbes = maxProbes;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public RotatingFileAppender build() {
            return new RotatingFileAppender(this);
        }
    }
}
