package ph.extremelogic.common.treelog.filter;

import ph.extremelogic.common.treelog.LogRecord;

import java.util.List;
import java.util.Locale;

/**
 * Boolean combination of child filters, evaluated in list order. An empty list admits
 * in both modes. A composite built from an unrecognized mode name rejects everything.
 */
public final class CompositeFilter implements Filter {

    public enum Mode {
        AND, OR;

        public static Mode forName(String name) {
            if (name == null) return null;
            try {
                return Mode.valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }

    private final List<Filter> filters;
    private final Mode mode;

    public CompositeFilter(List<? extends Filter> filters, Mode mode) {
        this.filters = filters == null ? List.of() : List.copyOf(filters);
        this.mode = mode;
    }

    public CompositeFilter(List<? extends Filter> filters, String mode) {
        this(filters, Mode.forName(mode));
    }

    @Override
    public boolean admit(LogRecord record) {
        if (mode == null) {
            return false;
        }
        if (filters.isEmpty()) {
            return true;
        }
        switch (mode) {
            case AND:
                for (Filter filter : filters) {
                    if (!Filters.safeAdmit(filter, record)) return false;
                }
                return true;
            case OR:
                for (Filter filter : filters) {
                    if (Filters.safeAdmit(filter, record)) return true;
                }
                return false;
            default:
                return false;
        }
    }

    public List<Filter> getFilters() { return filters; }
    public Mode getMode() { return mode; }
}
