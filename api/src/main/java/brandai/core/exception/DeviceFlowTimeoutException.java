package brandai.core.exception;

/**
 * Thrown when device flow polling exhausts its attempt budget.
 */
public class DeviceFlowTimeoutException extends BrandAiException {

    public DeviceFlowTimeoutException(String message) {
        super(ErrorKind.DEVICE_FLOW_TIMEOUT, message);
    }

    public DeviceFlowTimeoutException(String message, Throwable cause) {
        super(ErrorKind.DEVICE_FLOW_TIMEOUT, message, cause);
    }
}
