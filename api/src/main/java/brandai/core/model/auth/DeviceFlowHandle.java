package brandai.core.model.auth;

/**
 * Codes returned by GitHub when a device flow starts.
 *
 * @param deviceCode              opaque code used for token polling
 * @param userCode                code the user enters on the verification page
 * @param verificationUri         page where the user enters the code
 * @param verificationUriComplete verification page with the code pre-filled, may be null
 * @param expiresIn               lifetime of the device code in seconds
 * @param interval                minimum polling interval in seconds
 */
public record DeviceFlowHandle(
        String deviceCode,
        String userCode,
        String verificationUri,
        String verificationUriComplete,
        long expiresIn,
        long interval) {

    public static final long DEFAULT_INTERVAL_SECONDS = 5;

    public DeviceFlowHandle {
        if (deviceCode == null || deviceCode.isBlank()) {
            throw new IllegalArgumentException("Device code cannot be null or blank");
        }
        if (interval <= 0) {
            interval = DEFAULT_INTERVAL_SECONDS;
        }
    }

    /**
     * Instruction shown to the user.
     */
    public String message() {
        return "Visit " + verificationUri + " and enter code " + userCode;
    }
}
