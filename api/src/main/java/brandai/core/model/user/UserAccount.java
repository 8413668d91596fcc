package brandai.core.model.user;

import java.time.Instant;

import brandai.core.model.github.GitHubProfile;

/**
 * A local user linked to a GitHub identity.
 *
 * <p>The GitHub id is the natural key: at most one account exists per GitHub id
 * and it never changes once set. The local {@code id} is assigned by the store on
 * first insert and is null until then. Access and refresh tokens are stored
 * encrypted.
 *
 * @param id                    store-assigned identifier, null before first persistence
 * @param githubId              GitHub user id
 * @param username              GitHub login
 * @param email                 primary email, may be null
 * @param name                  display name, may be null
 * @param avatarUrl             avatar URL, may be null
 * @param usage                 GitHub usage counters
 * @param preferences           notification preferences
 * @param encryptedAccessToken  encrypted GitHub access token
 * @param tokenExpiresAt        access token expiry, may be null
 * @param encryptedRefreshToken encrypted GitHub refresh token, may be null
 * @param createdAt             when the account was created
 * @param updatedAt             when the account was last modified
 */
public record UserAccount(
        String id,
        long githubId,
        String username,
        String email,
        String name,
        String avatarUrl,
        GitHubUsage usage,
        NotificationPreferences preferences,
        String encryptedAccessToken,
        Instant tokenExpiresAt,
        String encryptedRefreshToken,
        Instant createdAt,
        Instant updatedAt) {

    public UserAccount {
        if (githubId <= 0) {
            throw new IllegalArgumentException("GitHub ID must be positive");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (usage == null) {
            usage = GitHubUsage.empty();
        }
        if (preferences == null) {
            preferences = NotificationPreferences.defaults();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Create an unsaved account for a GitHub user seen for the first time.
     *
     * @param profile     the GitHub profile
     * @param credentials the encrypted credentials
     * @param now         creation time
     * @return a new account without a local id
     */
    public static UserAccount create(GitHubProfile profile, ProviderCredentials credentials, Instant now) {
        return builder(profile.id())
                .username(profile.login())
                .email(profile.email())
                .name(profile.name())
                .avatarUrl(profile.avatarUrl())
                .usage(profile.usage())
                .encryptedAccessToken(credentials.encryptedAccessToken())
                .tokenExpiresAt(credentials.expiresAt())
                .encryptedRefreshToken(credentials.encryptedRefreshToken())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Copy with the store-assigned id.
     */
    public UserAccount withId(String newId) {
        return new UserAccount(
                newId,
                githubId,
                username,
                email,
                name,
                avatarUrl,
                usage,
                preferences,
                encryptedAccessToken,
                tokenExpiresAt,
                encryptedRefreshToken,
                createdAt,
                updatedAt);
    }

    /**
     * Copy with the mutable profile fields refreshed from GitHub.
     *
     * <p>The GitHub id is never changed.
     */
    public UserAccount withProfile(GitHubProfile profile, Instant now) {
        if (profile.id() != githubId) {
            throw new IllegalArgumentException("Profile belongs to GitHub user " + profile.id());
        }
        return new UserAccount(
                id,
                githubId,
                profile.login(),
                profile.email(),
                profile.name(),
                profile.avatarUrl(),
                profile.usage(),
                preferences,
                encryptedAccessToken,
                tokenExpiresAt,
                encryptedRefreshToken,
                createdAt,
                now);
    }

    /**
     * Copy with new credentials. A stored refresh token is kept when the new
     * credentials carry none.
     */
    public UserAccount withCredentials(ProviderCredentials credentials, Instant now) {
        final var refreshToken = credentials.encryptedRefreshToken() != null
                ? credentials.encryptedRefreshToken()
                : encryptedRefreshToken;
        return new UserAccount(
                id,
                githubId,
                username,
                email,
                name,
                avatarUrl,
                usage,
                preferences,
                credentials.encryptedAccessToken(),
                credentials.expiresAt(),
                refreshToken,
                createdAt,
                now);
    }

    public UserAccount withUpdatedAt(Instant now) {
        return new UserAccount(
                id,
                githubId,
                username,
                email,
                name,
                avatarUrl,
                usage,
                preferences,
                encryptedAccessToken,
                tokenExpiresAt,
                encryptedRefreshToken,
                createdAt,
                now);
    }

    public boolean hasRefreshToken() {
        return encryptedRefreshToken != null && !encryptedRefreshToken.isBlank();
    }

    public static Builder builder(long githubId) {
        return new Builder(githubId);
    }

    public static class Builder {
        private final long githubId;
        private String id;
        private String username;
        private String email;
        private String name;
        private String avatarUrl;
        private GitHubUsage usage;
        private NotificationPreferences preferences;
        private String encryptedAccessToken;
        private Instant tokenExpiresAt;
        private String encryptedRefreshToken;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(long githubId) {
            this.githubId = githubId;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder avatarUrl(String avatarUrl) {
            this.avatarUrl = avatarUrl;
            return this;
        }

        public Builder usage(GitHubUsage usage) {
            this.usage = usage;
            return this;
        }

        public Builder preferences(NotificationPreferences preferences) {
            this.preferences = preferences;
            return this;
        }

        public Builder encryptedAccessToken(String encryptedAccessToken) {
            this.encryptedAccessToken = encryptedAccessToken;
            return this;
        }

        public Builder tokenExpiresAt(Instant tokenExpiresAt) {
            this.tokenExpiresAt = tokenExpiresAt;
            return this;
        }

        public Builder encryptedRefreshToken(String encryptedRefreshToken) {
            this.encryptedRefreshToken = encryptedRefreshToken;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public UserAccount build() {
            return new UserAccount(
                    id,
                    githubId,
                    username,
                    email,
                    name,
                    avatarUrl,
                    usage,
                    preferences,
                    encryptedAccessToken,
                    tokenExpiresAt,
                    encryptedRefreshToken,
                    createdAt,
                    updatedAt);
        }
    }
}
