package domain.operation;

public final class RenameOperation extends ArticleOperation {

    private final String newName;

    public RenameOperation(String articleToken, String newName) {
        super(OperationKind.RENAME, articleToken);
        this.newName = newName == null ? "" : newName.trim();
    }

    public String getNewName() {
        return newName;
    }
}
