package infra.input;

import org.apache.poi.ss.usermodel.DateUtil;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Change-date cells come as real dates, as raw Excel serial numbers or as text.
 */
final class ChangeDateParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy"),
            DateTimeFormatter.ofPattern("d.M.yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy")
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy H:mm")
    );

    private ChangeDateParser() {
    }

    /**
     * Excel 1900 date system (day 0 = 1899-12-30 for all modern dates).
     */
    static LocalDate fromSerial(double serial) {
        LocalDateTime dt = DateUtil.getLocalDateTime(serial);
        return dt == null ? null : dt.toLocalDate();
    }

    /**
     * @return the date, or null when the text is not a date
     */
    static LocalDate parse(String text) {
        if (text == null || text.isBlank()) return null;
        String t = text.trim();

        if (t.matches("\\d+(\\.\\d+)?")) {
            return fromSerial(Double.parseDouble(t));
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return LocalDate.parse(t, f);
            } catch (DateTimeParseException ignore) {
                // next format
            }
        }
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(t, f).toLocalDate();
            } catch (DateTimeParseException ignore) {
                // next format
            }
        }
        return null;
    }
}
