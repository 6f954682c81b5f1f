package domain.id;

/**
 * Source of fresh article ids (one per call).
 */
@FunctionalInterface
public interface IdAllocator {

    long allocateNewId() throws IdAllocationException;
}
