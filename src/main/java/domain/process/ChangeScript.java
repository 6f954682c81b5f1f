package domain.process;

import domain.emit.EmittedStatement;
import domain.emit.StatementCategory;
import domain.model.ChangeWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one change-log file produced.
 *
 * <p>{@link #getStatements()} is already in execution order (renumber, add, change).
 * Markers are SQL comment lines for rows that produced no statement but need a reader's
 * attention; executors skip them.</p>
 */
public final class ChangeScript {

    private final String sourceName;
    private final String reportId;
    private final List<EmittedStatement> statements;
    private final List<String> markers;
    private final List<String> sourceRows;
    private final List<ChangeWarning> warnings;
    private final int allocationCount;

    public ChangeScript(String sourceName,
                        String reportId,
                        List<EmittedStatement> statements,
                        List<String> markers,
                        List<String> sourceRows,
                        List<ChangeWarning> warnings,
                        int allocationCount) {
        this.sourceName = sourceName == null ? "" : sourceName;
        this.reportId = reportId == null ? "" : reportId;
        this.statements = copy(statements);
        this.markers = copy(markers);
        this.sourceRows = copy(sourceRows);
        this.warnings = copy(warnings);
        this.allocationCount = allocationCount;
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(in));
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getReportId() {
        return reportId;
    }

    public List<EmittedStatement> getStatements() {
        return statements;
    }

    public List<String> getStatementTexts() {
        List<String> out = new ArrayList<>(statements.size());
        for (EmittedStatement s : statements) out.add(s.getText());
        return out;
    }

    public int count(StatementCategory category) {
        int n = 0;
        for (EmittedStatement s : statements) {
            if (s.getCategory() == category) n++;
        }
        return n;
    }

    public boolean hasStatements() {
        return !statements.isEmpty();
    }

    public List<String> getMarkers() {
        return markers;
    }

    /**
     * Tab-separated echo of every dated source row, for script commentary.
     */
    public List<String> getSourceRows() {
        return sourceRows;
    }

    public List<ChangeWarning> getWarnings() {
        return warnings;
    }

    public int getAllocationCount() {
        return allocationCount;
    }
}
