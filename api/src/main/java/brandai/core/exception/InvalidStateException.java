package brandai.core.exception;

/**
 * Thrown when an OAuth state value is unknown, expired or already used.
 */
public class InvalidStateException extends BrandAiException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(ErrorKind.INVALID_STATE, message, cause);
    }
}
