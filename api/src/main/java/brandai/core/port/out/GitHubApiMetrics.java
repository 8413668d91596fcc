package brandai.core.port.out;

import brandai.core.model.github.GitHubRequestOutcome;

/**
 * Port for recording GitHub API call metrics.
 */
public interface GitHubApiMetrics {

    /**
     * Record one completed call.
     *
     * @param outcome    how the call ended
     * @param durationMs duration in milliseconds
     */
    void recordRequest(GitHubRequestOutcome outcome, long durationMs);
}
