package brandai.core.exception;

/**
 * Thrown when GitHub reports the device code as expired. The device flow must be restarted.
 */
public class DeviceCodeExpiredException extends BrandAiException {

    public DeviceCodeExpiredException(String message) {
        super(ErrorKind.DEVICE_CODE_EXPIRED, message);
    }

    public DeviceCodeExpiredException(String message, Throwable cause) {
        super(ErrorKind.DEVICE_CODE_EXPIRED, message, cause);
    }
}
