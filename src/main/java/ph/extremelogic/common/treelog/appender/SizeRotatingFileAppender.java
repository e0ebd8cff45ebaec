package ph.extremelogic.common.treelog.appender;

import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.filter.Filter;
import ph.extremelogic.common.treelog.layout.Layout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classic backup rotation: one active file, and when the next line would push it past
 * {@code maxSize} it is shifted to {@code name.1}, {@code name.1} to {@code name.2} and
 * so on. The backup falling off the end ({@code name.backupCount}) is deleted or
 * handed to the compressor.
 */
public final class SizeRotatingFileAppender extends AbstractFileAppender {
    private final Path activePath;
    private final long maxSize;
    private final int backupCount;
    private final Compressor compressor;

    private int rotations;

    private SizeRotatingFileAppender(Builder builder) {
        super(builder.name, builder.layout, builder.filters);
        if (builder.fileName == null || builder.fileName.isBlank()) {
            throw new ConfigurationException("Size rotating appender requires a file name");
        }
        if (builder.maxSize <= 0) {
            throw new ConfigurationException("max_size must be positive: " + builder.maxSize);
        }
        if (builder.backupCount < 0) {
            throw new ConfigurationException("backup_count must not be negative: " + builder.backupCount);
        }
        this.activePath = builder.directory.resolve(builder.fileName);
        this.maxSize = builder.maxSize;
        this.backupCount = builder.backupCount;
        this.compressor = builder.compressor;
    }

    public static Builder newBuilder(String name, Path directory, String fileName) {
        return new Builder(name, directory, fileName);
    }

    @Override
    protected void onStart() {
        lock.lock();
        try {
            current = LogFile.open(activePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start SizeRotatingFileAppender: " + getName(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected LogFile prepare(int pendingBytes) throws IOException {
        if (current == null || !current.isOpen()) {
            current = LogFile.open(activePath);
        }
        long size = current.size();
        if (size > 0 && size + pendingBytes > maxSize) {
            rotate();
        }
        return current;
    }

    private void rotate() throws IOException {
        closeCurrent();

        if (backupCount == 0) {
            retire(activePath, compressor);
            Files.deleteIfExists(activePath);
        } else {
            Path oldest = backupPath(backupCount);
            if (Files.exists(oldest)) {
                retire(oldest, compressor);
            }
            for (int i = backupCount - 1; i >= 1; i--) {
                Path oldFile = backupPath(i);
                if (Files.exists(oldFile)) {
                    Files.move(oldFile, backupPath(i + 1), StandardCopyOption.REPLACE_EXISTING);
                }
            }
            if (Files.exists(activePath)) {
                Files.move(activePath, backupPath(1), StandardCopyOption.REPLACE_EXISTING);
            }
        }

        current = LogFile.open(activePath);
        rotations++;
    }

    Path backupPath(int index) {
        return activePath.resolveSibling(activePath.getFileName() + "." + index);
    }

    public Path getActivePath() { return activePath; }
    public long getMaxSize() { return maxSize; }
    public int getBackupCount() { return backupCount; }

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
        private long maxSize = RotatingFileAppender.DEFAULT_MAX_SIZE;
        private int backupCount = 5;
        private Compressor compressor;

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

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder backupCount(int backupCount) {
            this.backupCount = backupCount;
            return this;
        }

        public Builder compressor(Compressor compressor) {
            this.compressor = compressor;
            return this;
        }

        public SizeRotatingFileAppender build() {
            return new SizeRotatingFileAppender(this);
        }
    }
}
