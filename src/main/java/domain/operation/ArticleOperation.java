package domain.operation;

/**
 * Operation on one existing (or just created) article named by the row's id column.
 */
public abstract class ArticleOperation extends Operation {

    private final String articleToken;

    protected ArticleOperation(OperationKind kind, String articleToken) {
        super(kind);
        this.articleToken = articleToken == null ? null : articleToken.trim();
    }

    public final String getArticleToken() {
        return articleToken;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{article=" + articleToken + "}";
    }
}
