package brandai.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import brandai.core.model.auth.SessionIssued;

/**
 * Session token issued after a completed OAuth flow.
 */
public record SessionResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        UserSummaryResponse user) {

    public static SessionResponse from(SessionIssued session) {
        return new SessionResponse(
                session.accessToken(),
                session.tokenType(),
                session.expiresIn(),
                UserSummaryResponse.from(session.user()));
    }
}
