package domain.change;

import java.time.LocalDate;

/**
 * One normalized change-log row.
 *
 * <p>Only {@link #setArticleToken(String)} mutates a row: the first pass writes a
 * synthesized placeholder token into create-article rows whose id column is blank.</p>
 */
public final class ChangeRow {

    private final int rowNumber;
    private final LocalDate changeDate;
    private final String changeDateError;
    private String articleToken;
    private final String articleName;
    private final String actionText;
    private final String attributeText;

    public ChangeRow(
            int rowNumber,
            LocalDate changeDate,
            String articleToken,
            String articleName,
            String actionText,
            String attributeText
    ) {
        this(rowNumber, changeDate, null, articleToken, articleName, actionText, attributeText);
    }

    private ChangeRow(
            int rowNumber,
            LocalDate changeDate,
            String changeDateError,
            String articleToken,
            String articleName,
            String actionText,
            String attributeText
    ) {
        this.rowNumber = rowNumber;
        this.changeDate = changeDate;
        this.changeDateError = blankToNull(changeDateError);
        this.articleToken = blankToNull(articleToken);
        this.articleName = blankToNull(articleName);
        this.actionText = blankToNull(actionText);
        this.attributeText = blankToNull(attributeText);
    }

    /**
     * Row whose date cell holds something that is not a date. It is skipped by id
     * pre-allocation and reported as a failed row.
     */
    public static ChangeRow withInvalidDate(
            int rowNumber,
            String rawDate,
            String articleToken,
            String articleName,
            String actionText,
            String attributeText
    ) {
        return new ChangeRow(rowNumber, null, rawDate, articleToken, articleName, actionText, attributeText);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        return s.isBlank() ? null : s;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public LocalDate getChangeDate() {
        return changeDate;
    }

    public String getChangeDateError() {
        return changeDateError;
    }

    public boolean isDated() {
        return changeDate != null || changeDateError != null;
    }

    public boolean hasValidDate() {
        return changeDate != null;
    }

    public String getArticleToken() {
        return articleToken;
    }

    public boolean hasArticleToken() {
        return articleToken != null;
    }

    void setArticleToken(String articleToken) {
        this.articleToken = blankToNull(articleToken);
    }

    public String getArticleName() {
        return articleName;
    }

    public String getActionText() {
        return actionText;
    }

    public String getAttributeText() {
        return attributeText;
    }

    @Override
    public String toString() {
        return "ChangeRow{" +
                "row=" + rowNumber +
                ", date=" + (changeDate != null ? changeDate : changeDateError) +
                ", token='" + articleToken + '\'' +
                ", action='" + actionText + '\'' +
                '}';
    }
}
