package domain.operation;

public enum OperationKind {
    RENUMBER,
    RENAME,
    ADD_ARTICLE,
    SET_LEVEL_AND_PARENT,
    SET_ORDER,
    LOGICAL_DELETE,
    COMPOSITE,
    UNRECOGNIZED,
    SKIPPED
}
