package brandai.core.exception;

/**
 * Base type for every failure this service reports to callers.
 *
 * <p>Transport and library exceptions are caught where they occur and re-thrown
 * as one of the subclasses, so callers only ever see a stable {@link ErrorKind}.
 */
public abstract class BrandAiException extends RuntimeException {

    private final ErrorKind kind;

    protected BrandAiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected BrandAiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
