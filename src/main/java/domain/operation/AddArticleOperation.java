package domain.operation;

/**
 * Creates an article under {@code parentToken}. Values are kept as the literal text
 * found in the attribute column.
 */
public final class AddArticleOperation extends ArticleOperation {

    private final String name;
    private final String ord;
    private final String level;
    private final String parentToken;

    public AddArticleOperation(String articleToken, String name, String ord, String level, String parentToken) {
        super(OperationKind.ADD_ARTICLE, articleToken);
        this.name = trim(name);
        this.ord = trim(ord);
        this.level = trim(level);
        this.parentToken = trim(parentToken);
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }

    public String getName() {
        return name;
    }

    public String getOrd() {
        return ord;
    }

    public String getLevel() {
        return level;
    }

    public String getParentToken() {
        return parentToken;
    }
}
