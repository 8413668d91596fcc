package brandai.core.exception;

/**
 * Thrown when a required secret or client id is not configured. Fatal to the operation, not the process.
 */
public class ConfigurationException extends BrandAiException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION_ERROR, message, cause);
    }
}
