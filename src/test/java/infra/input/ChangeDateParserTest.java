package infra.input;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ChangeDateParserTest {

    @Test
    void accepts_common_text_formats() {
        LocalDate d = LocalDate.of(2025, 9, 5);
        assertEquals(d, ChangeDateParser.parse("2025-09-05"));
        assertEquals(d, ChangeDateParser.parse("05.09.2025"));
        assertEquals(d, ChangeDateParser.parse("5.9.2025"));
        assertEquals(d, ChangeDateParser.parse("05/09/2025"));
        assertEquals(d, ChangeDateParser.parse("2025-09-05 13:45:00"));
    }

    @Test
    void digits_are_excel_serials() {
        assertEquals(LocalDate.of(2025, 9, 15), ChangeDateParser.parse("45915"));
        assertEquals(LocalDate.of(2025, 9, 15), ChangeDateParser.fromSerial(45915.5));
    }

    @Test
    void garbage_is_null() {
        assertNull(ChangeDateParser.parse("soon"));
        assertNull(ChangeDateParser.parse(" "));
        assertNull(ChangeDateParser.parse(null));
    }
}
