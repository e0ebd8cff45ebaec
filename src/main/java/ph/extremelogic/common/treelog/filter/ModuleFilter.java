package ph.extremelogic.common.treelog.filter;

import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.LogRecord;

import java.util.Locale;

/**
 * Admits only records whose logger name equals the configured name.
 */
public final class ModuleFilter implements Filter {
    private final String moduleName;

    public ModuleFilter(String moduleName) {
        if (moduleName == null || moduleName.isBlank()) {
            throw new ConfigurationException("Module filter requires a module name");
        }
        // Logger names are stored lower-cased
        this.moduleName = moduleName.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean admit(LogRecord record) {
        return moduleName.equals(record.getLoggerName());
    }

    public String getModuleName() {
        return moduleName;
    }
}
