package brandai.core.exception;

/**
 * Stable error kinds surfaced to callers.
 *
 * <p>Each kind carries the HTTP status the REST layer reports for it. The kind
 * name is part of the public contract; messages are informational only.
 */
public enum ErrorKind {
    CONFIGURATION_ERROR(500),
    ENCRYPTION_ERROR(500),
    UPSTREAM_AUTH_ERROR(400),
    UPSTREAM_UNAVAILABLE(502),
    UPSTREAM_ERROR(502),
    RATE_LIMITED(429),
    INVALID_CREDENTIAL(401),
    EXPIRED_TOKEN(401),
    INVALID_TOKEN(401),
    INVALID_STATE(400),
    DEVICE_CODE_EXPIRED(400),
    DEVICE_FLOW_TIMEOUT(408),
    DUPLICATE_ACCOUNT(409);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
