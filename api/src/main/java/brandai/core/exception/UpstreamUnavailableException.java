package brandai.core.exception;

/**
 * Thrown when GitHub cannot be reached or the identity endpoints answer with a non-2xx status.
 */
public class UpstreamUnavailableException extends BrandAiException {

    public UpstreamUnavailableException(String message) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
