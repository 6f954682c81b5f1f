package infra.input;

import domain.change.ChangeLog;
import domain.change.ChangeRow;
import domain.input.ChangeLogReadException;
import domain.input.ChangeLogReader;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * CSV export of a change-log workbook, same layout as the sheet:
 * record 1 carries the report id in its second column, record 2 the headers.
 *
 * <p>Multi-line attribute values must be quoted.</p>
 */
public class ChangeLogCsvReader implements ChangeLogReader {

    private static final Logger log = LoggerFactory.getLogger(ChangeLogCsvReader.class);

    private final char delimiter;

    public ChangeLogCsvReader() {
        this(',');
    }

    public ChangeLogCsvReader(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public ChangeLog read(Path file) {
        if (file == null) throw new IllegalArgumentException("file is null");
        if (!Files.isRegularFile(file)) {
            throw new ChangeLogReadException("Change log not found: " + file.toAbsolutePath());
        }
        String source = file.getFileName().toString();

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setDelimiter(delimiter)
                     .setTrim(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();

            // 1) report id
            if (!it.hasNext()) throw new ChangeLogReadException("Empty change log: " + source);
            CSVRecord first = it.next();
            String reportId = first.size() > 1 ? first.get(1) : null;
            if (reportId == null || reportId.isBlank()) {
                throw new ChangeLogReadException("report_id not found in record 1, column 2: " + source);
            }

            // 2) headers
            if (!it.hasNext()) throw new ChangeLogReadException("Header record (record 2) is missing: " + source);
            CSVRecord headerRec = it.next();
            List<String> headers = new ArrayList<>(headerRec.size());
            for (String h : headerRec) headers.add(h);
            ChangeLogColumns cols = ChangeLogColumns.resolve(headers, source);

            // 3) records
            List<ChangeRow> rows = new ArrayList<>();
            int rowNumber = 2;
            while (it.hasNext()) {
                CSVRecord r = it.next();
                rowNumber++;

                String rawDate = get(r, cols.changeDate);
                String token = get(r, cols.articleId);
                String name = get(r, cols.articleName);
                String action = get(r, cols.action);
                String attrs = get(r, cols.attributeValue);
                if (ChangeRowBuilder.allBlank(rawDate, token, name, action, attrs)) continue;

                rows.add(ChangeRowBuilder.build(rowNumber, ChangeDateParser.parse(rawDate), rawDate,
                        token, name, action, attrs));
            }

            log.info("{}: report_id={}, rows={}", source, reportId.trim(), rows.size());
            return new ChangeLog(source, reportId, rows);

        } catch (IOException e) {
            throw new ChangeLogReadException("Failed to read change log CSV: " + file.toAbsolutePath(), e);
        }
    }

    private static String get(CSVRecord r, int idx) {
        if (idx < 0 || idx >= r.size()) return null;
        return r.get(idx);
    }
}
