package brandai.core.exception;

/**
 * Thrown when the GitHub REST API answers with an unexpected non-2xx status.
 */
public class UpstreamErrorException extends BrandAiException {

    private final int upstreamStatus;

    public UpstreamErrorException(int upstreamStatus, String message) {
        super(ErrorKind.UPSTREAM_ERROR, message);
        this.upstreamStatus = upstreamStatus;
    }

    public int upstreamStatus() {
        return upstreamStatus;
    }
}
