package brandai.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import brandai.core.model.auth.AuthorizationRequest;

/**
 * GitHub authorize URL for the authorization-code flow.
 */
public record AuthUrlResponse(@JsonProperty("auth_url") String authUrl, String state) {

    public static AuthUrlResponse from(AuthorizationRequest request) {
        return new AuthUrlResponse(request.authorizationUrl(), request.state());
    }
}
