package brandai.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import brandai.core.model.user.UserAccount;
import brandai.core.model.user.UserSummary;

/**
 * Public user summary returned with a session token.
 */
public record UserSummaryResponse(
        String id, @JsonProperty("github_id") long githubId, String username, String email) {

    public static UserSummaryResponse from(UserSummary summary) {
        return new UserSummaryResponse(summary.id(), summary.githubId(), summary.username(), summary.email());
    }

    public static UserSummaryResponse from(UserAccount account) {
        return from(UserSummary.from(account));
    }
}
