package brandai.core.exception;

/**
 * Thrown when GitHub rejects an authorization attempt (error body or missing access token).
 */
public class UpstreamAuthException extends BrandAiException {

    public UpstreamAuthException(String message) {
        super(ErrorKind.UPSTREAM_AUTH_ERROR, message);
    }

    public UpstreamAuthException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_AUTH_ERROR, message, cause);
    }
}
