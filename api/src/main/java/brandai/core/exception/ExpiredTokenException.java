package brandai.core.exception;

/**
 * Thrown when a session token is past its expiry.
 */
public class ExpiredTokenException extends BrandAiException {

    public ExpiredTokenException(String message) {
        super(ErrorKind.EXPIRED_TOKEN, message);
    }

    public ExpiredTokenException(String message, Throwable cause) {
        super(ErrorKind.EXPIRED_TOKEN, message, cause);
    }
}
