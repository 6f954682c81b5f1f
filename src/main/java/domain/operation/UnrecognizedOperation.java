package domain.operation;

public final class UnrecognizedOperation extends Operation {

    private final String actionText;

    public UnrecognizedOperation(String actionText) {
        super(OperationKind.UNRECOGNIZED);
        this.actionText = actionText == null ? "" : actionText.trim();
    }

    public String getActionText() {
        return actionText;
    }
}
