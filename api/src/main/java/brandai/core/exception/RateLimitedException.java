package brandai.core.exception;

/**
 * Thrown when GitHub reports that the API rate limit is exhausted. Not retried here.
 */
public class RateLimitedException extends BrandAiException {

    public RateLimitedException(String message) {
        super(ErrorKind.RATE_LIMITED, message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(ErrorKind.RATE_LIMITED, message, cause);
    }
}
