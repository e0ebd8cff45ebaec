package ph.extremelogic.common.treelog.appender;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Compresses a retired log file. Implementations write the archive, remove the source
 * and return the archive's path.
 */
@FunctionalInterface
public interface Compressor {
    Path compress(Path source) throws IOException;
}
