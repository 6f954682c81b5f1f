package infra.output;

import domain.emit.EmittedStatement;
import domain.output.SqlOutputWriter;
import domain.process.ChangeScript;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * {@link SqlOutputWriter} that stores every file's statements in one script.
 *
 * <pre>
 * -- ===========================================
 * -- Generated balance_api script
 * -- Generated at: 2025-09-15 10:00:00
 * -- ===========================================
 *
 * -- Source: changes.xlsx
 * -- Report ID: 42
 * /*
 * 15.09.2025	...
 * *&#47;
 * -- Unrecognized action in row 7: ...
 * SELECT balance_api.fn_...(...);
 *
 * -- ===========================================
 * -- End of script
 * -- ===========================================
 * </pre>
 */
public final class SqlScriptFileWriter implements SqlOutputWriter {

    static final String RULE = "-- ===========================================";
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public SqlScriptFileWriter() {
        this(Clock.systemDefaultZone());
    }

    public SqlScriptFileWriter(Clock clock) {
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    @Override
    public void write(Path outFile, List<ChangeScript> scripts) {
        if (outFile == null) throw new IllegalArgumentException("outFile is null");
        if (scripts == null) throw new IllegalArgumentException("scripts is null");

        try {
            Path parent = outFile.toAbsolutePath().normalize().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outFile, e);
        }

        try (BufferedWriter w = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
            w.write(RULE + "\n");
            w.write("-- Generated balance_api script\n");
            w.write("-- Generated at: " + LocalDateTime.now(clock).format(TS) + "\n");
            w.write(RULE + "\n\n");

            for (ChangeScript s : scripts) {
                writeSection(w, s);
                w.write("\n");
            }

            w.write(RULE + "\n");
            w.write("-- End of script\n");
            w.write(RULE + "\n");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write SQL script: " + outFile, e);
        }
    }

    private static void writeSection(BufferedWriter w, ChangeScript s) throws IOException {
        w.write("-- Source: " + s.getSourceName() + "\n");
        w.write("-- Report ID: " + s.getReportId() + "\n");

        if (!s.getSourceRows().isEmpty()) {
            w.write("/*\n");
            for (String line : s.getSourceRows()) {
                // keep the echo from closing the block early
                w.write(line.replace("*/", "* /") + "\n");
            }
            w.write("*/\n");
        }

        for (String marker : s.getMarkers()) {
            w.write(marker + "\n");
        }
        for (EmittedStatement st : s.getStatements()) {
            w.write(st.getText() + "\n");
        }
    }
}
