package brandai.core.model.github;

/**
 * Outcome of a single GitHub REST API call.
 */
public enum GitHubRequestOutcome {
    SUCCESS,
    RATE_LIMITED,
    UNAUTHORIZED,
    ERROR,
    UNAVAILABLE
}
