package infra.input;

import domain.change.ChangeRow;

import java.time.LocalDate;

/**
 * Builds a {@link ChangeRow} from cell values, telling apart an empty date cell
 * (row skipped later) from an unreadable one (row reported as failed).
 */
final class ChangeRowBuilder {

    private ChangeRowBuilder() {
    }

    static ChangeRow build(int rowNumber,
                           LocalDate date,
                           String rawDate,
                           String articleToken,
                           String articleName,
                           String action,
                           String attributeValue) {
        if (date == null && rawDate != null && !rawDate.isBlank()) {
            return ChangeRow.withInvalidDate(rowNumber, rawDate.trim(), articleToken, articleName, action, attributeValue);
        }
        return new ChangeRow(rowNumber, date, articleToken, articleName, action, attributeValue);
    }

    static boolean allBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return false;
        }
        return true;
    }
}
