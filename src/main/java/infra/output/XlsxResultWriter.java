package infra.output;

import domain.model.ChangeWarning;
import domain.model.FileProcessingResult;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/** XLSX report output backed by {@link ProcessingReportXlsxWriter}. */
public final class XlsxResultWriter implements ResultWriter {

    private final ProcessingReportXlsxWriter delegate;

    public XlsxResultWriter(ProcessingReportXlsxWriter delegate) {
        this.delegate = delegate == null ? new ProcessingReportXlsxWriter() : delegate;
    }

    @Override
    public void write(Path resultXlsx, List<FileProcessingResult> results, List<ChangeWarning> warnings) {
        delegate.write(resultXlsx, results, warnings);
    }
}
