package brandai.core.model.user;

/**
 * Usage counters copied from the GitHub profile. Each counter may be absent.
 */
public record GitHubUsage(Integer publicRepos, Integer privateRepos, Integer followers, Integer following) {

    public static GitHubUsage empty() {
        return new GitHubUsage(null, null, null, null);
    }
}
