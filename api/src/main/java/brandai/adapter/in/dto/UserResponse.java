package brandai.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import brandai.core.model.user.UserAccount;

/**
 * Profile of the signed-in user. Credential fields are never exposed.
 */
public record UserResponse(
        String id,
        @JsonProperty("github_id") long githubId,
        String username,
        String email,
        String name,
        @JsonProperty("avatar_url") String avatarUrl,
        @JsonProperty("public_repos") Integer publicRepos,
        @JsonProperty("private_repos") Integer privateRepos,
        Integer followers,
        Integer following,
        String cadence,
        String tone,
        boolean emojis,
        boolean hashtags,
        @JsonProperty("token_expires_at") Instant tokenExpiresAt,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static UserResponse from(UserAccount account) {
        return new UserResponse(
                account.id(),
                account.githubId(),
                account.username(),
                account.email(),
                account.name(),
                account.avatarUrl(),
                account.usage().publicRepos(),
                account.usage().privateRepos(),
                account.usage().followers(),
                account.usage().following(),
                account.preferences().cadence().value(),
                account.preferences().tone().value(),
                account.preferences().emojis(),
                account.preferences().hashtags(),
                account.tokenExpiresAt(),
                account.createdAt(),
                account.updatedAt());
    }
}
