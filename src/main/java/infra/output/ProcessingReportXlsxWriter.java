package infra.output;

import domain.model.ChangeWarning;
import domain.model.FileProcessingResult;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: SUCCESS/SKIP/FAILED per input file, statement counts</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class ProcessingReportXlsxWriter {

    static final String[] RESULT_HEADERS = {
            "status", "source", "reportId", "statements", "renumber", "add", "change", "message"
    };
    static final String[] WARNING_HEADERS = {
            "code", "source", "row", "articleToken", "message", "detail"
    };

    private static void writeResultSheet(Workbook wb, List<FileProcessingResult> results) {
        Sheet sh = wb.createSheet("result");
        int r = 0;
        header(sh.createRow(r++), RESULT_HEADERS);

        for (FileProcessingResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(it.getStatus());
            row.createCell(1).setCellValue(it.getSource());
            row.createCell(2).setCellValue(it.getReportId());
            row.createCell(3).setCellValue(it.getStatementCount());
            row.createCell(4).setCellValue(it.getRenumberCount());
            row.createCell(5).setCellValue(it.getAddCount());
            row.createCell(6).setCellValue(it.getChangeCount());
            row.createCell(7).setCellValue(it.getMessage());
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<ChangeWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        int r = 0;
        header(sh.createRow(r++), WARNING_HEADERS);

        for (ChangeWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(w.getCode() == null ? "" : w.getCode().name());
            row.createCell(1).setCellValue(nullToEmpty(w.getSource()));
            if (w.getRowNumber() > 0) row.createCell(2).setCellValue(w.getRowNumber());
            row.createCell(3).setCellValue(nullToEmpty(w.getArticleToken()));
            row.createCell(4).setCellValue(nullToEmpty(w.getMessage()));
            row.createCell(5).setCellValue(nullToEmpty(w.getDetail()));
        }
    }

    private static void header(Row row, String[] names) {
        for (int c = 0; c < names.length; c++) row.createCell(c).setCellValue(names[c]);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public void write(Path resultXlsx, List<FileProcessingResult> results, List<ChangeWarning> warnings) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath().normalize().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
