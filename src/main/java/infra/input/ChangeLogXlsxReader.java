package infra.input;

import domain.change.ChangeLog;
import domain.change.ChangeRow;
import domain.input.ChangeLogReadException;
import domain.input.ChangeLogReader;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Change-log workbook reader (first sheet).
 *
 * <pre>
 * row 1 : (label) | report_id
 * row 2 : headers (дата изменения, id статьи, имя статьи, действие, значение атрибута)
 * row 3+: changes
 * </pre>
 */
public class ChangeLogXlsxReader implements ChangeLogReader {

    private static final Logger log = LoggerFactory.getLogger(ChangeLogXlsxReader.class);

    private static final int REPORT_ID_ROW = 0;
    private static final int REPORT_ID_COL = 1;
    private static final int HEADER_ROW = 1;

    @Override
    public ChangeLog read(Path file) {
        if (file == null) throw new IllegalArgumentException("file is null");
        if (!Files.isRegularFile(file)) {
            throw new ChangeLogReadException("Change log not found: " + file.toAbsolutePath());
        }
        String source = file.getFileName().toString();

        try (InputStream is = Files.newInputStream(file);
             Workbook wb = new XSSFWorkbook(is)) {

            Sheet sheet = wb.getSheetAt(0);

            String reportId = text(cell(sheet.getRow(REPORT_ID_ROW), REPORT_ID_COL));
            if (reportId == null || reportId.isBlank()) {
                throw new ChangeLogReadException("report_id not found in cell B1: " + source);
            }

            Row headerRow = sheet.getRow(HEADER_ROW);
            if (headerRow == null) {
                throw new ChangeLogReadException("Header row (row 2) is missing: " + source);
            }
            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                String h = text(headerRow.getCell(c));
                headers.add(h == null ? "" : h);
            }
            ChangeLogColumns cols = ChangeLogColumns.resolve(headers, source);

            List<ChangeRow> rows = new ArrayList<>();
            for (int r = HEADER_ROW + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;

                String token = text(cell(row, cols.articleId));
                String name = text(cell(row, cols.articleName));
                String action = text(cell(row, cols.action));
                String attrs = text(cell(row, cols.attributeValue));

                Cell dateCell = cell(row, cols.changeDate);
                String rawDate = text(dateCell);
                if (ChangeRowBuilder.allBlank(rawDate, token, name, action, attrs)) continue;

                rows.add(ChangeRowBuilder.build(r + 1, date(dateCell), rawDate, token, name, action, attrs));
            }

            log.info("{}: report_id={}, rows={}", source, reportId, rows.size());
            return new ChangeLog(source, reportId, rows);

        } catch (ChangeLogReadException e) {
            throw e;
        } catch (Exception e) {
            throw new ChangeLogReadException("Failed to read change log XLSX: " + file.toAbsolutePath(), e);
        }
    }

    private static Cell cell(Row row, int idx) {
        if (row == null || idx < 0) return null;
        return row.getCell(idx);
    }

    private static CellType typeOf(Cell cell) {
        CellType t = cell.getCellType();
        return t == CellType.FORMULA ? cell.getCachedFormulaResultType() : t;
    }

    /**
     * Cell as text. Whole numbers lose their ".0" so that ids stay ids.
     */
    static String text(Cell cell) {
        if (cell == null) return null;
        switch (typeOf(cell)) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    static LocalDate date(Cell cell) {
        if (cell == null) return null;
        switch (typeOf(cell)) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate();
                }
                return ChangeDateParser.fromSerial(cell.getNumericCellValue());
            case STRING:
                return ChangeDateParser.parse(cell.getStringCellValue());
            default:
                return null;
        }
    }
}
