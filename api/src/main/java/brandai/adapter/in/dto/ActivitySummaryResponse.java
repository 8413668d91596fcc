package brandai.adapter.in.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import brandai.core.model.activity.ActivitySummary;

/**
 * Aggregated activity counts and the most recent items of each kind.
 */
public record ActivitySummaryResponse(
        int repositories,
        int pushes,
        @JsonProperty("pull_requests") int pullRequests,
        int issues,
        int commits,
        @JsonProperty("repositories_list") List<RepositoryItem> repositoriesList,
        @JsonProperty("recent_pushes") List<Map<String, Object>> recentPushes,
        @JsonProperty("recent_prs") List<Map<String, Object>> recentPullRequests,
        @JsonProperty("recent_issues") List<Map<String, Object>> recentIssues,
        @JsonProperty("recent_commits") List<Map<String, Object>> recentCommits) {

    /**
     * Repository entry of the summary.
     */
    public record RepositoryItem(String name, @JsonProperty("updated_at") String updatedAt) {}

    public static ActivitySummaryResponse from(ActivitySummary summary) {
        return new ActivitySummaryResponse(
                summary.totalRepositories(),
                summary.totalPushes(),
                summary.totalPullRequests(),
                summary.totalIssues(),
                summary.totalCommits(),
                summary.repositoriesList().stream()
                        .map(repo -> new RepositoryItem(repo.name(), repo.updatedAt()))
                        .toList(),
                GitHubItems.toMaps(summary.recentPushes()),
                GitHubItems.toMaps(summary.recentPullRequests()),
                GitHubItems.toMaps(summary.recentIssues()),
                GitHubItems.toMaps(summary.recentCommits()));
    }
}
