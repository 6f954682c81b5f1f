package domain.change;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One input file: the report id from its header cell plus its rows in file order.
 */
public final class ChangeLog {

    private final String sourceName;
    private final String reportId;
    private final List<ChangeRow> rows;

    public ChangeLog(String sourceName, String reportId, List<ChangeRow> rows) {
        if (reportId == null || reportId.isBlank()) {
            throw new IllegalArgumentException("reportId is blank: " + sourceName);
        }
        this.sourceName = sourceName == null ? "" : sourceName;
        this.reportId = reportId.trim();
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getReportId() {
        return reportId;
    }

    public List<ChangeRow> getRows() {
        return rows;
    }

    /**
     * Writes a placeholder token into a row. Only the id pre-allocation pass does this.
     */
    public void assignPlaceholder(ChangeRow row, String placeholder) {
        row.setArticleToken(placeholder);
    }
}
