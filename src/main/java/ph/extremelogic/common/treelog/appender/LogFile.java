package ph.extremelogic.common.treelog.appender;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * An append-only log file with tracked size and line count. Not thread-safe; the
 * owning appender guards it with its lock.
 */
final class LogFile implements Closeable {
    private final Path path;
    private FileChannel channel;
    private long size;
    private long lines;

    private LogFile(Path path, FileChannel channel, long size, long lines) {
        this.path = path;
        this.channel = channel;
        this.size = size;
        this.lines = lines;
    }

    /**
     * Opens {@code path} for appending, creating it and its directories if absent.
     */
    static LogFile open(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND,
                StandardOpenOption.WRITE);
        try {
            long size = channel.size();
            long lines = size == 0 ? 0 : countLines(path);
            return new LogFile(path, channel, size, lines);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    static long countLines(Path path) throws IOException {
        long count = 0;
        byte[] buffer = new byte[8192];
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                for (int i = 0; i < read; i++) {
                    if (buffer[i] == '\n') count++;
                }
            }
        }
        return count;
    }

    void write(byte[] bytes) throws IOException {
        if (channel == null || !channel.isOpen()) {
            throw new IOException("File channel is closed: " + path);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        channel.force(false);
        size += bytes.length;
        for (byte b : bytes) {
            if (b == '\n') lines++;
        }
    }

    Path path() { return path; }
    long size() { return size; }
    long lines() { return lines; }

    boolean isOpen() {
        return channel != null && channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        FileChannel c = channel;
        channel = null;
        if (c != null && c.isOpen()) {
            c.close();
        }
    }
}
