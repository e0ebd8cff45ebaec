package ph.extremelogic.common.treelog.filter;

import ph.extremelogic.common.treelog.LogRecord;
import ph.extremelogic.common.treelog.api.Level;

import java.util.Objects;

public final class LevelFilter implements Filter {
    private final Level threshold;

    public LevelFilter(Level threshold) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    @Override
    public boolean admit(LogRecord record) {
        return record.getLevel().isAtLeast(threshold);
    }

    public Level getThreshold() {
        return threshold;
    }
}
