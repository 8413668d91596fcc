package brandai.core.exception;

/**
 * Thrown when a token cannot be encrypted or decrypted.
 */
public class EncryptionException extends BrandAiException {

    public EncryptionException(String message) {
        super(ErrorKind.ENCRYPTION_ERROR, message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(ErrorKind.ENCRYPTION_ERROR, message, cause);
    }
}
