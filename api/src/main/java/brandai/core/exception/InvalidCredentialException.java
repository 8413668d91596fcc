package brandai.core.exception;

/**
 * Thrown when GitHub rejects the stored access token. The user has to authenticate again.
 */
public class InvalidCredentialException extends BrandAiException {

    public InvalidCredentialException(String message) {
        super(ErrorKind.INVALID_CREDENTIAL, message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(ErrorKind.INVALID_CREDENTIAL, message, cause);
    }
}
