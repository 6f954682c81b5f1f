package domain.operation;

/**
 * A row that matched an operation but lacks what the operation needs.
 */
public final class SkippedOperation extends Operation {

    private final OperationKind matched;
    private final String reason;

    public SkippedOperation(OperationKind matched, String reason) {
        super(OperationKind.SKIPPED);
        this.matched = matched;
        this.reason = reason == null ? "" : reason;
    }

    public OperationKind getMatched() {
        return matched;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "SkippedOperation{" + matched + ": " + reason + "}";
    }
}
