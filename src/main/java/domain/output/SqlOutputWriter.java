package domain.output;

import domain.process.ChangeScript;

import java.nio.file.Path;
import java.util.List;

/** Writes the generated scripts to a file. */
public interface SqlOutputWriter {
    void write(Path outFile, List<ChangeScript> scripts);
}
