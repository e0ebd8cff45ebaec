package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.layout.Layout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rotates the active file on a schedule and, optionally, on size. The rotated file is
 * renamed with the start of its period ({@code name.yyyy-MM-dd_HH-mm-ss}); rotated
 * files beyond {@code backupCount} are retired oldest first.
 */
public final class TimedRotatingFileAppender extends AbstractFileAppender {

    public enum When {
        SECONDS("S"), MINUTES("M"), HOURS("H"), DAYS("D"), MIDNIGHT("MIDNIGHT");

        private final String code;

        When(String code) {
            this.code = code;
        }

        public static When forCode(String code) {
            if (code == null) return null;
            String normalized = code.trim().toUpperCase(Locale.ROOT);
            for (When when : values()) {
                if (when.code.equals(normalized) || when.name().equals(normalized)) {
                    return when;
                }
            }
            return null;
        }
    }

    private static final DateTimeFormatter SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final Path activePath;
    private final When when;
    private final int interval;
    private final int backupCount;
    private final long maxSize;
    private final Compressor compressor;
    private final Clock clock;
    private final Pattern rotatedName;

    // Guarded by lock
    private Instant periodStart;
    private Instant nextRollover;
    private int rotations;

    private TimedRotatingFileAppender(Builder builder) {
        super(builder.name, builder.layout, builder.filters);
        if (builder.fileName == null || builder.fileName.isBlank()) {
            throw new ConfigurationException("Timed rotating appender requires a file name");
        }
        if (builder.when == null) {
            throw new ConfigurationException("Timed rotating appender requires a rotation unit");
        }
        if (builder.interval < 1) {
            throw new ConfigurationException("interval must be positive: " + builder.interval);
        }
        if (builder.backupCount < 0) {
            throw new ConfigurationException("backup_count must not be negative: " + builder.backupCount);
        }
        this.activePath = builder.directory.resolve(builder.fileName);
        this.when = builder.when;
        this.interval = builder.interval;
        this.backupCount = builder.backupCount;
        this.maxSize = builder.maxSize;
        this.compressor = builder.compressor;
        this.clock = builder.clock;
        this.rotatedName = Pattern.compile(Pattern.quote(builder.fileName)
                + "\\.\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}(\\.\\d+)?");
    }

    public static Builder newBuilder(String name, Path directory, String fileName) {
        return new Builder(name, directory, fileName);
    }

    @Override
    protected void onStart() {
        lock.lock();
        try {
            current = LogFile.open(activePath);
            periodStart = clock.instant();
            nextRollover = computeNextRollover(periodStart);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start TimedRotatingFileAppender: " + getName(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected LogFile prepare(int pendingBytes) throws IOException {
        if (current == null || !current.isOpen()) {
            current = LogFile.open(activePath);
        }
        Instant now = clock.instant();
        boolean due = !now.isBefore(nextRollover);
        boolean full = maxSize > 0 && current.size() > 0 && current.size() + pendingBytes > maxSize;
        if (due || full) {
            rotate(now);
        }
        return current;
    }

    private void rotate(Instant now) throws IOException {
        closeCurrent();

        if (Files.exists(activePath) && Files.size(activePath) > 0) {
            Files.move(activePath, rotatedPath(periodStart));
        }
        current = LogFile.open(activePath);
        periodStart = now;
        nextRollover = computeNextRollover(now);
        rotations++;

        List<Path> rotated = listRotated();
        for (int i = 0; i < rotated.size() - backupCount; i++) {
            retire(rotated.get(i), compressor);
        }
    }

    private Path rotatedPath(Instant start) {
        String base = activePath.getFileName() + "." + LocalDateTime.ofInstant(start, clock.getZone()).format(SUFFIX_FORMAT);
        Path target = activePath.resolveSibling(base);
        // Size-triggered rotations can happen several times within one second
        int n = 1;
        while (Files.exists(target)) {
            target = activePath.resolveSibling(base + "." + n++);
        }
        return target;
    }

    /**
     * Rotated files of this appender, oldest first.
     */
    List<Path> listRotated() throws IOException {
        List<Path> rotated = new ArrayList<>();
        Path dir = activePath.getParent();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                if (rotatedName.matcher(path.getFileName().toString()).matches()) {
                    rotated.add(path);
                }
            }
        }
        Collections.sort(rotated, (a, b) -> compareRotated(a.getFileName().toString(), b.getFileName().toString()));
        return rotated;
    }

    private static int compareRotated(String a, String b) {
        // Same timestamp: the un-numbered file came first, then .1, .2, ...
        int cmp = stripCounter(a).compareTo(stripCounter(b));
        return cmp != 0 ? cmp : Integer.compare(counter(a), counter(b));
    }

    private static String stripCounter(String name) {
        int tsEnd = name.lastIndexOf('_') + 9;
        return tsEnd <= name.length() ? name.substring(0, tsEnd) : name;
    }

    private static int counter(String name) {
        int tsEnd = name.lastIndexOf('_') + 9;
        return tsEnd < name.length() ? Integer.parseInt(name.substring(tsEnd + 1)) : 0;
    }

    Instant computeNextRollover(Instant from) {
        ZoneId zone = clock.getZone();
        switch (when) {
            case SECONDS:
                return from.plus(Duration.ofSeconds(interval));
            case MINUTES:
                return from.plus(Duration.ofMinutes(interval));
            case HOURS:
                return from.plus(Duration.ofHours(interval));
            case DAYS:
                return from.plus(Duration.ofDays(interval));
            case MIDNIGHT:
                LocalDate day = LocalDate.ofInstant(from, zone).plusDays(interval);
                return day.atStartOfDay(zone).toInstant();
            default:
                throw new IllegalStateException("Unknown rotation unit: " + when);
        }
    }

    public Path getActivePath() { return activePath; }
    public When getWhen() { return when; }
    public int getInterval() { return interval; }
    public int getBackupCount() { return backupCount; }

    public Instant getNextRollover() {
        lock.lock();
        try {
            return nextRollover;
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

    public static final class Builder {
        private final String name;
        private final Path directory;
        private final String fileName;
        private Layout layout;
        private final List<Filter> filters = new ArrayList<>();
        private When when = When.DAYS;
        private int interval = 1;
        private int backupCount = 5;
        private long maxSize = 0;
        private Compressor compressor;
        private Clock clock = Clock.systemDefaultZone();

        private Builder(String name, Path directory, String fileName) {
            this.name = name;
            this.directory = Objects.requireNonNull(directory, "directory");
            this.fileName = fileName;
        }

        public Builder layout(Layout layout) {
            this.layout = layout;
            return this;
        }

        public Builder filters(List<? extends Filter> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public Builder when(When when) {
            this.when = when;
            return this;
        }

        public Builder interval(int interval) {
            this.interval = interval;
            return this;
        }

        public Builder backupCount(int backupCount) {
            this.backupCount = backupCount;
            return this;
        }

        /**
         * Additional size trigger; zero disables it.
         */
        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder compressor(Compressor compressor) {
            this.compressor = compressor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public TimedRotatingFileAppender build() {
            return new TimedRotatingFileAppender(this);
        }
    }
}
