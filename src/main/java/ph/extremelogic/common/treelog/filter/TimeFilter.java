package ph.extremelogic.common.treelog.filter;

import ph.extremelogic.common.treelog.LogRecord;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Admits records created inside a daily time window, bounds included. A window whose
 * start is after its end wraps past midnight.
 */
public final class TimeFilter implements Filter {
    private final LocalTime start;
    private final LocalTime end;
    private final ZoneId zone;

    public TimeFilter(LocalTime start, LocalTime end) {
        this(start, end, ZoneId.systemDefault());
    }

    public TimeFilter(LocalTime start, LocalTime end, ZoneId zone) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public boolean admit(LogRecord record) {
        LocalTime time = LocalTime.ofInstant(record.getCreatedAt(), zone);
        if (start.isAfter(end)) {
            return !time.isBefore(start) || !time.isAfter(end);
        }
        return !time.isBefore(start) && !time.isAfter(end);
    }

    public LocalTime getStart() { return start; }
    public LocalTime getEnd() { return end; }
}
