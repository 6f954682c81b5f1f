package infra.input;

import domain.change.ChangeLog;
import domain.input.ChangeLogReadException;
import domain.input.ChangeLogReader;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks the reader by file extension (.xlsx / .csv).
 */
public final class ChangeLogReaders implements ChangeLogReader {

    private final ChangeLogReader xlsx;
    private final ChangeLogReader csv;

    public ChangeLogReaders() {
        this(new ChangeLogXlsxReader(), new ChangeLogCsvReader());
    }

    public ChangeLogReaders(ChangeLogReader xlsx, ChangeLogReader csv) {
        this.xlsx = xlsx;
        this.csv = csv;
    }

    public static boolean isSupported(Path file) {
        String n = file == null || file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        return (n.endsWith(".xlsx") || n.endsWith(".csv")) && !n.startsWith("~$");
    }

    @Override
    public ChangeLog read(Path file) {
        String n = file == null || file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (n.endsWith(".xlsx")) return xlsx.read(file);
        if (n.endsWith(".csv")) return csv.read(file);
        throw new ChangeLogReadException("Unsupported change log format (expected .xlsx or .csv): " + file);
    }
}
