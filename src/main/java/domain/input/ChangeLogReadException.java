package domain.input;

public class ChangeLogReadException extends RuntimeException {

    public ChangeLogReadException(String message) {
        super(message);
    }

    public ChangeLogReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
