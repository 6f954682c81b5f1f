package domain.id;

/**
 * The id source could not hand out a new id.
 */
public class IdAllocationException extends Exception {

    public IdAllocationException(String message) {
        super(message);
    }

    public IdAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
