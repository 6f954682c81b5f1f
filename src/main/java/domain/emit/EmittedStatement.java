package domain.emit;

/**
 * One rendered procedure call plus the bucket it belongs to.
 */
public final class EmittedStatement {

    private final StatementCategory category;
    private final int rowNumber;
    private final String text;

    public EmittedStatement(StatementCategory category, int rowNumber, String text) {
        if (category == null) throw new IllegalArgumentException("category is null");
        this.category = category;
        this.rowNumber = rowNumber;
        this.text = text == null ? "" : text;
    }

    public StatementCategory getCategory() {
        return category;
    }

    /**
     * Spreadsheet row the statement was built from.
     */
    public int getRowNumber() {
        return rowNumber;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return category + "@" + rowNumber + ": " + text;
    }
}
