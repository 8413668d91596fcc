package brandai.core.model.github;

import brandai.core.model.user.GitHubUsage;

/**
 * The authenticated GitHub user as returned by {@code GET /user}.
 *
 * @param id        GitHub user id
 * @param login     GitHub login
 * @param email     public email, may be null
 * @param name      display name, may be null
 * @param avatarUrl avatar URL, may be null
 * @param usage     repository and follower counters
 */
public record GitHubProfile(long id, String login, String email, String name, String avatarUrl, GitHubUsage usage) {

    public GitHubProfile {
        if (id <= 0) {
            throw new IllegalArgumentException("GitHub profile id must be positive");
        }
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("GitHub profile login cannot be null or blank");
        }
        if (usage == null) {
            usage = GitHubUsage.empty();
        }
    }
}
