package brandai.core.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import brandai.core.model.activity.ActivityQuery;
import brandai.core.model.activity.ActivitySummary;

/**
 * Inbound port for GitHub activity queries.
 *
 * <p>Every operation takes the encrypted access token stored on the user account.
 * Items are returned as GitHub delivers them.
 */
public interface ActivityQueries {

    /**
     * List the user's repositories, most recently updated first.
     */
    Uni<List<JsonObject>> getRepositories(String encryptedToken, Optional<Instant> since, int page, int perPage);

    /**
     * List every repository of the user, following pagination up to the configured page cap.
     */
    Uni<List<JsonObject>> getAllRepositories(String encryptedToken, Optional<Instant> since);

    /**
     * List push events, filtered locally on {@code created_at}.
     */
    Uni<List<JsonObject>> getPushes(String encryptedToken, ActivityQuery query);

    /**
     * List pull requests, filtered locally on {@code updated_at}.
     */
    Uni<List<JsonObject>> getPullRequests(String encryptedToken, ActivityQuery query);

    /**
     * List issues, excluding pull requests, filtered locally on {@code updated_at}.
     */
    Uni<List<JsonObject>> getIssues(String encryptedToken, ActivityQuery query);

    /**
     * List commits, filtered by GitHub on since, until and author.
     */
    Uni<List<JsonObject>> getCommits(String encryptedToken, ActivityQuery query);

    /**
     * Summarize all activity kinds within the optional window.
     */
    Uni<ActivitySummary> getUserActivity(String encryptedToken, Optional<Instant> since, Optional<Instant> until);
}
