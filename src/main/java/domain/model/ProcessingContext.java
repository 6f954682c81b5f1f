package domain.model;

/**
 * Per-row context used for warning attribution.
 *
 * <p>Immutable and very small: source file + spreadsheet row + article token.</p>
 */
public final class ProcessingContext {

    private final String source;
    private final int rowNumber;
    private final String articleToken;

    public ProcessingContext(String source, int rowNumber, String articleToken) {
        this.source = safe(source);
        this.rowNumber = Math.max(0, rowNumber);
        this.articleToken = safe(articleToken).trim();
    }

    public static ProcessingContext ofFile(String source) {
        return new ProcessingContext(source, 0, "");
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    public String getSource() {
        return source;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public String getArticleToken() {
        return articleToken;
    }

    public ProcessingContext withToken(String token) {
        return new ProcessingContext(source, rowNumber, token);
    }
}
