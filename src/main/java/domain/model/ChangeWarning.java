package domain.model;

/**
 * A single warning emitted while interpreting a change log.
 *
 * <p>Warnings are not fatal; they indicate a row that was skipped or needs review.</p>
 */
public final class ChangeWarning {

    private final WarningCode code;
    private final String source;
    private final int rowNumber;
    private final String articleToken;
    private final String message;
    private final String detail;

    public ChangeWarning(
            WarningCode code,
            String source,
            int rowNumber,
            String articleToken,
            String message,
            String detail
    ) {
        this.code = code == null ? WarningCode.ROW_FAILED : code;
        this.source = nullToEmpty(source);
        this.rowNumber = rowNumber;
        this.articleToken = nullToEmpty(articleToken);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static ChangeWarning of(WarningCode code, ProcessingContext ctx, String message) {
        return of(code, ctx, message, "");
    }

    public static ChangeWarning of(WarningCode code, ProcessingContext ctx, String message, String detail) {
        if (ctx == null) {
            return new ChangeWarning(code, "", 0, "", message, detail);
        }
        return new ChangeWarning(code, ctx.getSource(), ctx.getRowNumber(), ctx.getArticleToken(), message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getSource() {
        return source;
    }

    /**
     * 1-based spreadsheet row, 0 when the warning concerns the whole file.
     */
    public int getRowNumber() {
        return rowNumber;
    }

    public String getArticleToken() {
        return articleToken;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " " + source + (rowNumber > 0 ? " row " + rowNumber : "")
                + (articleToken.isEmpty() ? "" : " [" + articleToken + "]")
                + ": " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
