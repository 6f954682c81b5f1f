package domain.output;

import java.nio.file.Path;

import java.util.List;

import domain.model.ChangeWarning;

import domain.model.FileProcessingResult;

/** Saves the per-file processing report. */
public interface ResultWriter {

    void write(
            Path resultXlsx,
            List<FileProcessingResult> results,
            List<ChangeWarning> warnings
    );
}
