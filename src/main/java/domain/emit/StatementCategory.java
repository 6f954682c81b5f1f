package domain.emit;

/**
 * Output buckets, in the order they are concatenated: bulk reordering first, then
 * creation, then attribute/structural changes that may reference both.
 */
public enum StatementCategory {
    RENUMBER,
    ADD,
    CHANGE
}
