package infra.input;

import domain.change.ChangeLog;
import domain.change.ChangeRow;
import domain.input.ChangeLogReadException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ChangeLogXlsxReaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, Workbook wb) throws Exception {
        Path p = tempDir.resolve(name);
        try (OutputStream os = Files.newOutputStream(p)) {
            wb.write(os);
        }
        wb.close();
        return p;
    }

    private static void header(Sheet sh, String... names) {
        Row h = sh.createRow(1);
        for (int i = 0; i < names.length; i++) h.createCell(i).setCellValue(names[i]);
    }

    @Test
    void reads_report_id_header_and_rows() throws Exception {
        Workbook wb = new XSSFWorkbook();
        Sheet sh = wb.createSheet("log");
        Row top = sh.createRow(0);
        top.createCell(0).setCellValue("Report ID");
        top.createCell(1).setCellValue(42.0);
        header(sh, "Дата изменения", "ID статьи", "Имя статьи", "Действие", "Значение атрибута");

        CellStyle dateStyle = wb.createCellStyle();
        dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("dd.mm.yyyy"));

        Row r2 = sh.createRow(2);
        Cell d = r2.createCell(0);
        d.setCellValue(LocalDateTime.of(2025, 9, 15, 0, 0));
        d.setCellStyle(dateStyle);
        r2.createCell(1).setCellValue(100.0);
        r2.createCell(2).setCellValue("Revenue");
        r2.createCell(3).setCellValue("сменила название на");
        r2.createCell(4).setCellValue("Net revenue");

        sh.createRow(3); // blank row

        Row r4 = sh.createRow(4);
        r4.createCell(0).setCellValue("16.09.2025");
        r4.createCell(3).setCellValue("добавление статьи");
        r4.createCell(4).setCellValue("name=A\nord=1\nlvl=1\nparent=0");

        Row r5 = sh.createRow(5);
        r5.createCell(1).setCellValue("ID3");
        r5.createCell(3).setCellValue("no date here");

        ChangeLog log = new ChangeLogXlsxReader().read(write("changes.xlsx", wb));

        assertEquals("changes.xlsx", log.getSourceName());
        assertEquals("42", log.getReportId());
        assertEquals(3, log.getRows().size());

        ChangeRow first = log.getRows().get(0);
        assertEquals(3, first.getRowNumber());
        assertEquals(LocalDate.of(2025, 9, 15), first.getChangeDate());
        assertEquals("100", first.getArticleToken());
        assertEquals("Revenue", first.getArticleName());
        assertEquals("Net revenue", first.getAttributeText());

        ChangeRow second = log.getRows().get(1);
        assertEquals(5, second.getRowNumber());
        assertEquals(LocalDate.of(2025, 9, 16), second.getChangeDate());
        assertNull(second.getArticleToken());

        ChangeRow third = log.getRows().get(2);
        assertFalse(third.isDated());
    }

    @Test
    void raw_serial_number_in_date_column_is_a_date() throws Exception {
        Workbook wb = new XSSFWorkbook();
        Sheet sh = wb.createSheet();
        sh.createRow(0).createCell(1).setCellValue("R-1");
        header(sh, "change date", "article id", "action");
        Row r = sh.createRow(2);
        r.createCell(0).setCellValue(45915.0); // 2025-09-15
        r.createCell(1).setCellValue("77");
        r.createCell(2).setCellValue("логически удаляем из документа");

        ChangeLog log = new ChangeLogXlsxReader().read(write("en.xlsx", wb));

        assertEquals("R-1", log.getReportId());
        assertEquals(LocalDate.of(2025, 9, 15), log.getRows().get(0).getChangeDate());
        assertNull(log.getRows().get(0).getAttributeText());
    }

    @Test
    void unreadable_date_text_is_kept_as_error() throws Exception {
        Workbook wb = new XSSFWorkbook();
        Sheet sh = wb.createSheet();
        sh.createRow(0).createCell(1).setCellValue("42");
        header(sh, "date", "id", "action");
        Row r = sh.createRow(2);
        r.createCell(0).setCellValue("tomorrow");
        r.createCell(1).setCellValue("77");

        ChangeRow row = new ChangeLogXlsxReader().read(write("bad.xlsx", wb)).getRows().get(0);

        assertTrue(row.isDated());
        assertFalse(row.hasValidDate());
        assertEquals("tomorrow", row.getChangeDateError());
    }

    @Test
    void missing_report_id_fails() throws Exception {
        Workbook wb = new XSSFWorkbook();
        Sheet sh = wb.createSheet();
        sh.createRow(0).createCell(0).setCellValue("Report ID");
        header(sh, "date", "id");

        Path p = write("noid.xlsx", wb);
        assertThrows(ChangeLogReadException.class, () -> new ChangeLogXlsxReader().read(p));
    }

    @Test
    void missing_required_column_fails() throws Exception {
        Workbook wb = new XSSFWorkbook();
        Sheet sh = wb.createSheet();
        sh.createRow(0).createCell(1).setCellValue("42");
        header(sh, "date", "action");

        Path p = write("nocol.xlsx", wb);
        ChangeLogReadException e = assertThrows(ChangeLogReadException.class, () -> new ChangeLogXlsxReader().read(p));
        assertTrue(e.getMessage().contains("id статьи"));
    }

    @Test
    void missing_file_fails() {
        assertThrows(ChangeLogReadException.class,
                () -> new ChangeLogXlsxReader().read(tempDir.resolve("absent.xlsx")));
    }
}
