package domain.output;

/**
 * A statement failed; the file's transaction was rolled back.
 */
public class ScriptExecutionException extends Exception {

    private final int statementIndex;

    public ScriptExecutionException(String message, int statementIndex, Throwable cause) {
        super(message, cause);
        this.statementIndex = statementIndex;
    }

    /**
     * 1-based index of the failed statement, 0 when the failure was not tied to one.
     */
    public int getStatementIndex() {
        return statementIndex;
    }
}
