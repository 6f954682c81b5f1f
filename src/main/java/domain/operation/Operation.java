package domain.operation;

/**
 * Structural operation a change-log row stands for.
 *
 * <p>Operations carry tokens, not ids: ids are resolved when the statement is built.</p>
 */
public abstract class Operation {

    private final OperationKind kind;

    protected Operation(OperationKind kind) {
        this.kind = kind;
    }

    public final OperationKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
