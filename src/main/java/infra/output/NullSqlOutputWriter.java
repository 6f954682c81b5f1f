package infra.output;

import domain.output.SqlOutputWriter;
import domain.process.ChangeScript;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (execute mode).
 */
public final class NullSqlOutputWriter implements SqlOutputWriter {
    @Override
    public void write(Path outFile, List<ChangeScript> scripts) {
        // intentionally no-op
    }
}
