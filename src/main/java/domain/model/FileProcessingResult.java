package domain.model;

/**
 * Outcome of processing one change-log file, for reporting.
 *
 * <p>Kept as a simple value object (no behavior) so the CLI and the XLSX report
 * can share it.</p>
 */
public final class FileProcessingResult {

    public static final String SUCCESS = "SUCCESS";
    public static final String SKIP = "SKIP";
    public static final String FAILED = "FAILED";

    /**
     * SUCCESS / SKIP / FAILED
     */
    private final String status;
    private final String source;
    private final String reportId;
    private final int renumberCount;
    private final int addCount;
    private final int changeCount;

    /**
     * optional reason for SKIP / FAILED
     */
    private final String message;

    public FileProcessingResult(
            String status,
            String source,
            String reportId,
            int renumberCount,
            int addCount,
            int changeCount,
            String message
    ) {
        this.status = nullToEmpty(status);
        this.source = nullToEmpty(source);
        this.reportId = nullToEmpty(reportId);
        this.renumberCount = renumberCount;
        this.addCount = addCount;
        this.changeCount = changeCount;
        this.message = nullToEmpty(message);
    }

    public static FileProcessingResult failed(String source, String message) {
        return new FileProcessingResult(FAILED, source, "", 0, 0, 0, message);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public String getSource() {
        return source;
    }

    public String getReportId() {
        return reportId;
    }

    public int getRenumberCount() {
        return renumberCount;
    }

    public int getAddCount() {
        return addCount;
    }

    public int getChangeCount() {
        return changeCount;
    }

    public int getStatementCount() {
        return renumberCount + addCount + changeCount;
    }

    public String getMessage() {
        return message;
    }
}
