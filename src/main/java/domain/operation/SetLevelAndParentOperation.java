package domain.operation;

public final class SetLevelAndParentOperation extends ArticleOperation {

    /** Level passed when the row names no {@code lvl}. */
    public static final String LEVEL_UNCHANGED = "-1";

    private final String level;
    private final String parentToken;

    public SetLevelAndParentOperation(String articleToken, String level, String parentToken) {
        super(OperationKind.SET_LEVEL_AND_PARENT, articleToken);
        this.level = (level == null || level.isBlank()) ? LEVEL_UNCHANGED : level.trim();
        this.parentToken = (parentToken == null || parentToken.isBlank()) ? null : parentToken.trim();
    }

    public String getLevel() {
        return level;
    }

    public boolean isLevelChanged() {
        return !LEVEL_UNCHANGED.equals(level);
    }

    /**
     * Parent token, or null when the row names none.
     */
    public String getParentToken() {
        return parentToken;
    }
}
