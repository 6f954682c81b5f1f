package domain.input;

import domain.change.ChangeLog;

import java.nio.file.Path;

/** Reads one change-log file into normalized rows. */
public interface ChangeLogReader {

    /**
     * @throws ChangeLogReadException when the file cannot be read or lacks the report id
     *                                or a required column
     */
    ChangeLog read(Path file);
}
