package brandai.adapter.in.rest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import brandai.adapter.in.dto.ActivitySummaryResponse;
import brandai.adapter.in.dto.ApiResponse;
import brandai.adapter.in.dto.GitHubItems;
import brandai.core.model.activity.ActivityQuery;
import brandai.core.port.in.ActivityQueries;
import brandai.core.port.in.SessionAuthentication;

/**
 * REST endpoints exposing the signed-in user's GitHub activity.
 *
 * <p>All endpoints require a BrandAI session token. Items are returned as GitHub
 * delivers them.
 */
@Path("/github")
@Produces(MediaType.APPLICATION_JSON)
public class GitHubActivityResource {

    private final ActivityQueries activity;
    private final SessionAuthentication sessionAuthentication;

    @Inject
    public GitHubActivityResource(ActivityQueries activity, SessionAuthentication sessionAuthentication) {
        this.activity = activity;
        this.sessionAuthentication = sessionAuthentication;
    }

    @GET
    @Path("/repos")
    public Uni<ApiResponse<List<Map<String, Object>>>> repositories(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @QueryParam("since") String since,
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("per_page") @DefaultValue("30") int perPage,
            @QueryParam("all") @DefaultValue("false") boolean all) {
        final Optional<Instant> sinceInstant = RequestParams.instant(since, "since");
        return withToken(authorization, token -> all
                        ? activity.getAllRepositories(token, sinceInstant)
                        : activity.getRepositories(token, sinceInstant, page, perPage))
                .map(items -> ApiResponse.ok("Repositories retrieved", GitHubItems.toMaps(items)));
    }

    @GET
    @Path("/pushes")
    public Uni<ApiResponse<List<Map<String, Object>>>> pushes(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @QueryParam("since") String since,
            @QueryParam("until") String until,
            @QueryParam("repo") String repo,
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("per_page") @DefaultValue("30") int perPage) {
        final ActivityQuery query = query(since, until, repo, null, null, page, perPage);
        return withToken(authorization, token -> activity.getPushes(token, query))
                .map(items -> ApiResponse.ok("Pushes retrieved", GitHubItems.toMaps(items)));
    }

    @GET
    @Path("/pull-requests")
    public Uni<ApiResponse<List<Map<String, Object>>>> pullRequests(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @QueryParam("since") String since,
            @QueryParam("until") String until,
            @QueryParam("repo") String repo,
            @QueryParam("state") @DefaultValue("all") String state,
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("per_page") @DefaultValue("30") int perPage) {
        final ActivityQuery query = query(since, until, repo, state, null, page, perPage);
        return withToken(authorization, token -> activity.getPullRequests(token, query))
                .map(items -> ApiResponse.ok("Pull requests retrieved", GitHubItems.toMaps(items)));
    }

    @GET
    @Path("/issues")
    public Uni<ApiResponse<List<Map<String, Object>>>> issues(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @QueryParam("since") String since,
            @QueryParam("until") String until,
            @QueryParam("repo") String repo,
            @QueryParam("state") @DefaultValue("all") String state,
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("per_page") @DefaultValue("30") int perPage) {
        final ActivityQuery query = query(since, until, repo, state, null, page, perPage);
        return withToken(authorization, token -> activity.getIssues(token, query))
                .map(items -> ApiResponse.ok("Issues retrieved", GitHubItems.toMaps(items)));
    }

    @GET
    @Path("/commits")
    public Uni<ApiResponse<List<Map<String, Object>>>> commits(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @QueryParam("since") String since,
            @QueryParam("until") String until,
            @QueryParam("repo") String repo,
            @QueryParam("author") String author,
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("per_page") @DefaultValue("30") int perPage) {
        final ActivityQuery query = query(since, until, repo, null, author, page, perPage);
        return withToken(authorization, token -> activity.getCommits(token, query))
                .map(items -> ApiResponse.ok("Commits retrieved", GitHubItems.toMaps(items)));
    }

    @GET
    @Path("/activity")
    public Uni<ApiResponse<ActivitySummaryResponse>> summary(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @QueryParam("since") String since,
            @QueryParam("until") String until) {
        final Optional<Instant> sinceInstant = RequestParams.instant(since, "since");
        final Optional<Instant> untilInstant = RequestParams.instant(until, "until");
        return withToken(authorization, token -> activity.getUserActivity(token, sinceInstant, untilInstant))
                .map(summary -> ApiResponse.ok("Activity retrieved", ActivitySummaryResponse.from(summary)));
    }

    private <T> Uni<T> withToken(String authorization, Function<String, Uni<T>> call) {
        final String sessionToken = RequestParams.bearerToken(authorization);
        return sessionAuthentication
                .authenticate(sessionToken)
                .flatMap(account -> call.apply(account.encryptedAccessToken()));
    }

    private static ActivityQuery query(
            String since, String until, String repo, String state, String author, int page, int perPage) {
        return ActivityQuery.builder()
                .since(RequestParams.instant(since, "since").orElse(null))
                .until(RequestParams.instant(until, "until").orElse(null))
                .repo(repo)
                .state(state)
                .author(author)
                .page(page)
                .perPage(perPage)
                .build();
    }
}
