package domain.emit;

import java.time.format.DateTimeFormatter;

/**
 * Fixed parts of the generated calls: API schema, open validity date, date format,
 * literal quoting policy.
 */
public final class BalanceApiSettings {

    public static final String DEFAULT_SCHEMA = "balance_api";
    public static final String DEFAULT_NEW_VALID_DATE = "2099-12-31";
    public static final String DEFAULT_DATE_PATTERN = "dd.MM.yyyy";

    private final String schema;
    private final String newValidDate;
    private final DateTimeFormatter dateFormat;
    private final boolean escapeLiterals;

    public BalanceApiSettings(String schema, String newValidDate, String datePattern, boolean escapeLiterals) {
        this.schema = isBlank(schema) ? DEFAULT_SCHEMA : schema.trim();
        this.newValidDate = isBlank(newValidDate) ? DEFAULT_NEW_VALID_DATE : newValidDate.trim();
        this.dateFormat = DateTimeFormatter.ofPattern(isBlank(datePattern) ? DEFAULT_DATE_PATTERN : datePattern.trim());
        this.escapeLiterals = escapeLiterals;
    }

    public static BalanceApiSettings defaults() {
        return new BalanceApiSettings(DEFAULT_SCHEMA, DEFAULT_NEW_VALID_DATE, DEFAULT_DATE_PATTERN, false);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getSchema() {
        return schema;
    }

    public String getNewValidDate() {
        return newValidDate;
    }

    public DateTimeFormatter getDateFormat() {
        return dateFormat;
    }

    /**
     * When false, text values are embedded between single quotes as-is (an embedded
     * quote breaks the statement). When true, single quotes are doubled.
     */
    public boolean isEscapeLiterals() {
        return escapeLiterals;
    }

    public String function(String name) {
        return schema + "." + name;
    }
}
