package domain.operation;

public final class SetOrderOperation extends ArticleOperation {

    private final String ord;

    public SetOrderOperation(String articleToken, String ord) {
        super(OperationKind.SET_ORDER, articleToken);
        this.ord = ord == null ? "" : ord.trim();
    }

    public String getOrd() {
        return ord;
    }
}
