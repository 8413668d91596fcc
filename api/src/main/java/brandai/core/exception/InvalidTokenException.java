package brandai.core.exception;

/**
 * Thrown when a session token is malformed, badly signed or refers to an unknown user.
 */
public class InvalidTokenException extends BrandAiException {

    public InvalidTokenException(String message) {
        super(ErrorKind.INVALID_TOKEN, message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(ErrorKind.INVALID_TOKEN, message, cause);
    }
}
