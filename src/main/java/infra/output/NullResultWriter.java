package infra.output;

import domain.model.ChangeWarning;
import domain.model.FileProcessingResult;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<FileProcessingResult> results, List<ChangeWarning> warnings) {
        // intentionally no-op
    }
}
