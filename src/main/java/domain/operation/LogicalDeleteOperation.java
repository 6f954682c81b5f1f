package domain.operation;

public final class LogicalDeleteOperation extends ArticleOperation {

    public LogicalDeleteOperation(String articleToken) {
        super(OperationKind.LOGICAL_DELETE, articleToken);
    }
}
