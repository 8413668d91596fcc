package brandai.core.model.activity;

import java.util.List;

import io.vertx.core.json.JsonObject;

/**
 * Overview of a user's recent GitHub activity.
 *
 * <p>Counts cover everything fetched; the lists hold at most
 * {@link #RECENT_LIMIT} of the most recent items of each kind.
 */
public record ActivitySummary(
        int totalRepositories,
        int totalPushes,
        int totalPullRequests,
        int totalIssues,
        int totalCommits,
        List<RepositoryRef> repositoriesList,
        List<JsonObject> recentPushes,
        List<JsonObject> recentPullRequests,
        List<JsonObject> recentIssues,
        List<JsonObject> recentCommits) {

    public static final int RECENT_LIMIT = 10;

    public ActivitySummary {
        repositoriesList = List.copyOf(repositoriesList);
        recentPushes = List.copyOf(recentPushes);
        recentPullRequests = List.copyOf(recentPullRequests);
        recentIssues = List.copyOf(recentIssues);
        recentCommits = List.copyOf(recentCommits);
    }
}
