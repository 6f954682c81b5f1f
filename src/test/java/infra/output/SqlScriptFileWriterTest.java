package infra.output;

import domain.emit.EmittedStatement;
import domain.emit.StatementCategory;
import domain.process.ChangeScript;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlScriptFileWriterTest {

    @TempDir
    Path tempDir;

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-09-15T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void should_write_banner_sections_and_footer() throws Exception {
        ChangeScript first = new ChangeScript("a.xlsx", "42",
                List.of(new EmittedStatement(StatementCategory.RENUMBER, 3, "SELECT 1;"),
                        new EmittedStatement(StatementCategory.CHANGE, 4, "SELECT 2;")),
                List.of("-- Unrecognized action in row 5: x"),
                List.of("15.09.2025\t100\t\tact\t\"a*/b\""),
                List.of(), 0);
        ChangeScript second = new ChangeScript("b.csv", "43", List.of(), List.of(), List.of(), List.of(), 0);

        Path out = tempDir.resolve("output").resolve("output.sql");
        new SqlScriptFileWriter(FIXED).write(out, List.of(first, second));

        assertTrue(Files.exists(out), "expected file not found: " + out);
        String content = Files.readString(out, StandardCharsets.UTF_8);

        assertTrue(content.startsWith(SqlScriptFileWriter.RULE + "\n"));
        assertTrue(content.contains("-- Generated at: 2025-09-15 10:00:00\n"));
        assertTrue(content.contains("-- Source: a.xlsx\n-- Report ID: 42\n/*\n"));
        assertTrue(content.contains("\"a* /b\"\n*/\n"));
        assertTrue(content.contains("-- Unrecognized action in row 5: x\nSELECT 1;\nSELECT 2;\n"));
        assertTrue(content.contains("-- Source: b.csv\n-- Report ID: 43\n\n"));
        assertTrue(content.endsWith("-- End of script\n" + SqlScriptFileWriter.RULE + "\n"));
        assertTrue(content.indexOf("a.xlsx") < content.indexOf("b.csv"));
    }
}
