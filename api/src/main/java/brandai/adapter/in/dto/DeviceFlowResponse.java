package brandai.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import brandai.core.model.auth.DeviceFlowHandle;

/**
 * Device and user codes for a started device flow.
 */
public record DeviceFlowResponse(
        @JsonProperty("device_code") String deviceCode,
        @JsonProperty("user_code") String userCode,
        @JsonProperty("verification_uri") String verificationUri,
        @JsonProperty("verification_uri_complete") String verificationUriComplete,
        @JsonProperty("expires_in") long expiresIn,
        long interval,
        String message) {

    public static DeviceFlowResponse from(DeviceFlowHandle handle) {
        return new DeviceFlowResponse(
                handle.deviceCode(),
                handle.userCode(),
                handle.verificationUri(),
                handle.verificationUriComplete(),
                handle.expiresIn(),
                handle.interval(),
                handle.message());
    }
}
