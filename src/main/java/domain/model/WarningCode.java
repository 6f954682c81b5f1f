package domain.model;

/**
 * Standard warning codes for change-log processing.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * A matched operation lacks a required attribute. The row contributes no statement.
     */
    MISSING_PRECONDITION,

    /**
     * An article or parent token could not be resolved to an id. The dependent operation is skipped.
     */
    UNRESOLVED_REFERENCE,

    /**
     * Action text matches no known phrase. A marker comment is emitted instead.
     */
    UNRECOGNIZED_ACTION,

    /**
     * Unexpected fault while handling a single row.
     */
    ROW_FAILED,

    /**
     * The id source failed to allocate an id for a temporary token.
     */
    ALLOCATION_FAILED,

    /**
     * An open-ended renumber directive does not follow a directive with a higher lower bound.
     */
    RENUMBER_ORDER_UNSUPPORTED,

    /**
     * The change date cell holds a value that cannot be read as a date.
     */
    INVALID_CHANGE_DATE,

    /**
     * A whole file could not be processed (unreadable, database unavailable, rolled back).
     */
    FILE_FAILED,

    /**
     * A file produced no statements.
     */
    NO_CHANGES
}
