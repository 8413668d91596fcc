package brandai.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to complete a device flow.
 *
 * @param deviceCode device code from the initiate call
 * @param userCode   user code shown to the user
 * @param interval   starting polling interval in seconds, optional
 */
public record DeviceFlowVerifyRequest(
        @JsonProperty("device_code") String deviceCode,
        @JsonProperty("user_code") String userCode,
        Integer interval) {}
