package brandai.core.service.activity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import brandai.core.config.ActivityConfig;
import brandai.core.exception.UpstreamErrorException;
import brandai.core.model.activity.ActivityQuery;
import brandai.core.model.activity.ActivitySummary;
import brandai.core.model.activity.RepositoryRef;
import brandai.core.port.in.ActivityQueries;
import brandai.core.port.out.GitHubApiClient;
import brandai.core.service.auth.TokenCipher;

/**
 * Aggregates GitHub activity for a signed-in user.
 *
 * <p>Queries scoped to one repository map to a single GitHub call. Pull requests,
 * issues and commits without a repository fan out over the user's most recently
 * updated repositories with bounded concurrency. Repositories that fail are
 * logged and skipped; the merged result is sorted newest first and then paged.
 */
@ApplicationScoped
public class ActivityService implements ActivityQueries {

    private static final Logger LOG = Logger.getLogger(ActivityService.class);

    static final String PUSH_EVENT = "PushEvent";
    static final String UPDATED_AT = "updated_at";
    static final String CREATED_AT = "created_at";
    static final String COMMIT_DATE = "commit.author.date";

    private final GitHubApiClient apiClient;
    private final TokenCipher tokenCipher;
    private final ActivityConfig config;

    @Inject
    public ActivityService(GitHubApiClient apiClient, TokenCipher tokenCipher, ActivityConfig config) {
        this.apiClient = apiClient;
        this.tokenCipher = tokenCipher;
        this.config = config;
    }

    @Override
    public Uni<List<JsonObject>> getRepositories(
            String encryptedToken, Optional<Instant> since, int page, int perPage) {
        final var paging = ActivityQuery.builder().page(page).perPage(perPage).build();
        return decrypt(encryptedToken)
                .flatMap(token -> listRepositories(token, since, paging.page(), paging.perPage()));
    }

    @Override
    public Uni<List<JsonObject>> getAllRepositories(String encryptedToken, Optional<Instant> since) {
        return decrypt(encryptedToken)
                .flatMap(token -> apiClient.fetchAllPages(
                        token, "/user/repos", repositoryParams(since), config.maxPages()));
    }

    @Override
    public Uni<List<JsonObject>> getPushes(String encryptedToken, ActivityQuery query) {
        return decrypt(encryptedToken).flatMap(token -> pushes(token, query));
    }

    @Override
    public Uni<List<JsonObject>> getPullRequests(String encryptedToken, ActivityQuery query) {
        return decrypt(encryptedToken).flatMap(token -> query.repo().isPresent()
                ? pullRequests(token, query)
                : fanOut(token, query, "pull requests", this::pullRequests, UPDATED_AT));
    }

    @Override
    public Uni<List<JsonObject>> getIssues(String encryptedToken, ActivityQuery query) {
        return decrypt(encryptedToken).flatMap(token -> query.repo().isPresent()
                ? issues(token, query)
                : fanOut(token, query, "issues", this::issues, UPDATED_AT));
    }

    @Override
    public Uni<List<JsonObject>> getCommits(String encryptedToken, ActivityQuery query) {
        return decrypt(encryptedToken).flatMap(token -> query.repo().isPresent()
                ? commits(token, query)
                : fanOut(token, query, "commits", this::commits, COMMIT_DATE));
    }

    @Override
    public Uni<ActivitySummary> getUserActivity(
            String encryptedToken, Optional<Instant> since, Optional<Instant> until) {
        final var query = ActivityQuery.builder()
                .since(since.orElse(null))
                .until(until.orElse(null))
                .perPage(ActivityQuery.MAX_PER_PAGE)
                .build();

        return Uni.combine()
                .all()
                .unis(
                        getRepositories(encryptedToken, since, 1, ActivityQuery.MAX_PER_PAGE),
                        getPushes(encryptedToken, query),
                        getPullRequests(encryptedToken, query),
                        getIssues(encryptedToken, query),
                        getCommits(encryptedToken, query))
                .asTuple()
                .map(all -> new ActivitySummary(
                        all.getItem1().size(),
                        all.getItem2().size(),
                        all.getItem3().size(),
                        all.getItem4().size(),
                        all.getItem5().size(),
                        recent(all.getItem1()).stream()
                                .map(repo -> new RepositoryRef(
                                        repo.getString("full_name"), repo.getString(UPDATED_AT)))
                                .toList(),
                        recent(all.getItem2()),
                        recent(all.getItem3()),
                        recent(all.getItem4()),
                        recent(all.getItem5())));
    }

    private Uni<String> decrypt(String encryptedToken) {
        return Uni.createFrom().item(() -> tokenCipher.decrypt(encryptedToken));
    }

    private Uni<List<JsonObject>> listRepositories(String token, Optional<Instant> since, int page, int perPage) {
        final Map<String, String> params = repositoryParams(since);
        params.put("page", String.valueOf(page));
        params.put("per_page", String.valueOf(perPage));
        return apiClient.getList(token, "/user/repos", params);
    }

    private Map<String, String> repositoryParams(Optional<Instant> since) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("sort", "updated");
        params.put("direction", "desc");
        since.ifPresent(s -> params.put("since", s.toString()));
        return params;
    }

    private Uni<List<JsonObject>> pushes(String token, ActivityQuery query) {
        final Uni<String> endpoint = query.repo().isPresent()
                ? Uni.createFrom().item("/repos/" + query.repo().get() + "/events")
                : apiClient.request(token, "GET", "/user", Map.of()).map(ActivityService::publicEventsPath);

        return endpoint.flatMap(path -> apiClient.getList(token, path, paging(query)))
                .map(events -> filterByWindow(
                        events.stream()
                                .filter(e -> PUSH_EVENT.equals(e.getString("type")))
                                .toList(),
                        query,
                        CREATED_AT));
    }

    private static String publicEventsPath(Object user) {
        final String login = user instanceof JsonObject profile ? profile.getString("login") : null;
        if (login == null || login.isBlank()) {
            throw new UpstreamErrorException(502, "GitHub user profile has no login");
        }
        return "/users/" + login + "/events/public";
    }

    private Uni<List<JsonObject>> pullRequests(String token, ActivityQuery query) {
        final Map<String, String> params = paging(query);
        params.put("state", query.state());
        params.put("sort", "updated");
        params.put("direction", "desc");
        return apiClient
                .getList(token, "/repos/" + query.repo().get() + "/pulls", params)
                .map(prs -> filterByWindow(prs, query, UPDATED_AT));
    }

    private Uni<List<JsonObject>> issues(String token, ActivityQuery query) {
        final Map<String, String> params = paging(query);
        params.put("state", query.state());
        params.put("sort", "updated");
        params.put("direction", "desc");
        return apiClient
                .getList(token, "/repos/" + query.repo().get() + "/issues", params)
                .map(items -> filterByWindow(
                        items.stream()
                                .filter(item -> !item.containsKey("pull_request"))
                                .toList(),
                        query,
                        UPDATED_AT));
    }

    private Uni<List<JsonObject>> commits(String token, ActivityQuery query) {
        final Map<String, String> params = paging(query);
        query.since().ifPresent(s -> params.put("since", s.toString()));
        query.until().ifPresent(u -> params.put("until", u.toString()));
        query.author().ifPresent(a -> params.put("author", a));
        return apiClient.getList(token, "/repos/" + query.repo().get() + "/commits", params);
    }

    /**
     * Run a single-repository query against each of the user's repositories and merge the results.
     *
     * <p>Each repository's items carry its position in the repository listing through the merge,
     * so items with equal timestamps keep listing order, then upstream order, whatever order the
     * per-repository calls complete in.
     */
    private Uni<List<JsonObject>> fanOut(
            String token,
            ActivityQuery query,
            String kind,
            RepositoryQuery perRepository,
            String timestampPath) {
        final ActivityQuery perRepositoryPaging = query.withPaging(1, query.perPage());

        return listRepositories(token, Optional.empty(), 1, config.maxRepositories())
                .map(ActivityService::repositoryNames)
                .flatMap(names -> Multi.createFrom()
                        .range(0, names.size())
                        .onItem()
                        .transformToUni(index -> perRepository
                                .fetch(token, perRepositoryPaging.withRepo(names.get(index)))
                                .onFailure()
                                .recoverWithItem(fetchFailed(kind, names.get(index)))
                                .map(items -> new RepositoryItems(index, items)))
                        .merge(config.fanOutConcurrency())
                        .collect()
                        .asList())
                .map(results -> {
                    final List<JsonObject> merged = new ArrayList<>();
                    results.stream()
                            .sorted(Comparator.comparingInt(RepositoryItems::index))
                            .forEach(result -> merged.addAll(result.items()));
                    merged.sort(ActivityTimestamps.newestFirst(timestampPath));
                    return window(merged, query.page(), query.perPage());
                });
    }

    private static List<String> repositoryNames(List<JsonObject> repositories) {
        return repositories.stream()
                .map(repo -> repo.getString("full_name"))
                .filter(Objects::nonNull)
                .toList();
    }

    private static Function<Throwable, List<JsonObject>> fetchFailed(String kind, String repository) {
        return error -> {
            LOG.warnf("Failed to fetch %s for %s: %s", kind, repository, error.getMessage());
            return List.of();
        };
    }

    private static Map<String, String> paging(ActivityQuery query) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("page", String.valueOf(query.page()));
        params.put("per_page", String.valueOf(query.perPage()));
        return params;
    }

    private static List<JsonObject> filterByWindow(List<JsonObject> items, ActivityQuery query, String path) {
        if (!query.hasTimeWindow()) {
            return items;
        }
        return items.stream()
                .filter(item -> ActivityTimestamps.read(item, path)
                        .map(query::includes)
                        .orElse(false))
                .toList();
    }

    private static List<JsonObject> window(List<JsonObject> items, int page, int perPage) {
        final long start = (long) (page - 1) * perPage;
        if (start >= items.size()) {
            return List.of();
        }
        final int end = (int) Math.min(items.size(), start + perPage);
        return List.copyOf(items.subList((int) start, end));
    }

    private static List<JsonObject> recent(List<JsonObject> items) {
        return items.subList(0, Math.min(items.size(), ActivitySummary.RECENT_LIMIT));
    }

    private record RepositoryItems(int index, List<JsonObject> items) {}

    @FunctionalInterface
    private interface RepositoryQuery {
        Uni<List<JsonObject>> fetch(String token, ActivityQuery query);
    }
}
