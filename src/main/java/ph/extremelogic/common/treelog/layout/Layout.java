package ph.extremelogic.common.treelog.layout;

import ph.extremelogic.common.treelog.LogRecord;

/**
 * Pure rendering of a record to text.
 */
public interface Layout {

    String toSerializable(LogRecord record);

    /**
     * Plain text wrapped in the level's color and a reset sequence.
     */
    default String toDecorated(LogRecord record) {
        return record.getLevel().color().wrap(toSerializable(record));
    }

    String getContentType();
}
