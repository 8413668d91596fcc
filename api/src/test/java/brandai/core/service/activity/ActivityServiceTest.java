package brandai.core.service.activity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import brandai.core.config.ActivityConfig;
import brandai.core.exception.EncryptionException;
import brandai.core.exception.UpstreamErrorException;
import brandai.core.exception.UpstreamUnavailableException;
import brandai.core.model.activity.ActivityQuery;
import brandai.core.port.out.GitHubApiClient;
import brandai.core.service.auth.TokenCipher;

@DisplayName("ActivityService")
class ActivityServiceTest {

    private static final String TOKEN = "gho_activity";

    private GitHubApiClient apiClient;
    private ActivityConfig config;
    private TokenCipher tokenCipher;
    private ActivityService service;
    private String encryptedToken;

    @BeforeEach
    void setUp() {
        apiClient = mock(GitHubApiClient.class);
        config = mock(ActivityConfig.class);
        when(config.maxPages()).thenReturn(10);
        when(config.maxRepositories()).thenReturn(100);
        when(config.fanOutConcurrency()).thenReturn(5);

        tokenCipher = new TokenCipher(Optional.of("activity-secret"), TokenCipher.MIN_ITERATIONS);
        encryptedToken = tokenCipher.encrypt(TOKEN);
        service = new ActivityService(apiClient, tokenCipher, config);
    }

    private static JsonObject repo(String fullName) {
        return new JsonObject().put("full_name", fullName).put("updated_at", "2024-01-01T00:00:00Z");
    }

    private static JsonObject updated(int id, String updatedAt) {
        return new JsonObject().put("id", id).put("updated_at", updatedAt);
    }

    private void stubList(String endpoint, List<JsonObject> items) {
        when(apiClient.getList(eq(TOKEN), eq(endpoint), anyMap())).thenReturn(Uni.createFrom().item(items));
    }

    @Nested
    @DisplayName("repositories")
    class Repositories {

        @Test
        @DisplayName("should request repositories sorted by update with paging")
        void shouldRequestSortedPage() {
            stubList("/user/repos", List.of(repo("octo/one")));

            var repos = service.getRepositories(encryptedToken, Optional.empty(), 2, 50).await().indefinitely();

            assertEquals(1, repos.size());
            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
            verify(apiClient).getList(eq(TOKEN), eq("/user/repos"), params.capture());
            assertEquals("updated", params.getValue().get("sort"));
            assertEquals("desc", params.getValue().get("direction"));
            assertEquals("2", params.getValue().get("page"));
            assertEquals("50", params.getValue().get("per_page"));
            assertFalse(params.getValue().containsKey("since"));
        }

        @Test
        @DisplayName("should fetch all pages up to the configured cap")
        void shouldFetchAllPages() {
            when(apiClient.fetchAllPages(eq(TOKEN), eq("/user/repos"), anyMap(), eq(10)))
                    .thenReturn(Uni.createFrom().item(List.of(repo("octo/one"), repo("octo/two"))));

            var repos = service.getAllRepositories(encryptedToken, Optional.of(Instant.parse("2024-01-01T00:00:00Z")))
                    .await()
                    .indefinitely();

            assertEquals(2, repos.size());
        }

        @Test
        @DisplayName("should reject an out of range page size")
        void shouldRejectPageSize() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.getRepositories(encryptedToken, Optional.empty(), 1, 101));
        }

        @Test
        @DisplayName("should fail when the stored token cannot be decrypted")
        void shouldFailOnUndecryptableToken() {
            assertThrows(
                    EncryptionException.class,
                    () -> service.getRepositories("garbage", Optional.empty(), 1, 30).await().indefinitely());
            verify(apiClient, never()).getList(anyString(), anyString(), anyMap());
        }
    }

    @Nested
    @DisplayName("fan-out")
    class FanOut {

        @Test
        @DisplayName("should merge pull requests across repositories newest first and skip failures")
        void shouldMergeAndSkipFailures() {
            stubList("/user/repos", List.of(repo("octo/one"), repo("octo/two"), repo("octo/three")));
            stubList("/repos/octo/one/pulls", List.of(updated(1, "2024-01-02T00:00:00Z")));
            when(apiClient.getList(eq(TOKEN), eq("/repos/octo/two/pulls"), anyMap()))
                    .thenReturn(Uni.createFrom().failure(new UpstreamErrorException(404, "Not Found")));
            stubList(
                    "/repos/octo/three/pulls",
                    List.of(updated(3, "2024-01-05T00:00:00Z"), updated(4, "2024-01-01T00:00:00Z")));

            var prs = service.getPullRequests(encryptedToken, ActivityQuery.defaults()).await().indefinitely();

            assertEquals(List.of(3, 1, 4), prs.stream().map(pr -> pr.getInteger("id")).toList());
        }

        @Test
        @DisplayName("should page the merged result")
        void shouldPageMergedResult() {
            stubList("/user/repos", List.of(repo("octo/one"), repo("octo/two")));
            stubList(
                    "/repos/octo/one/pulls",
                    List.of(updated(1, "2024-01-04T00:00:00Z"), updated(2, "2024-01-02T00:00:00Z")));
            stubList(
                    "/repos/octo/two/pulls",
                    List.of(updated(3, "2024-01-03T00:00:00Z"), updated(4, "2024-01-01T00:00:00Z")));

            var query = ActivityQuery.builder().page(2).perPage(2).build();
            var prs = service.getPullRequests(encryptedToken, query).await().indefinitely();

            assertEquals(List.of(2, 4), prs.stream().map(pr -> pr.getInteger("id")).toList());
        }

        @Test
        @DisplayName("should sort merged commits by author date")
        void shouldSortCommitsByAuthorDate() {
            stubList("/user/repos", List.of(repo("octo/one"), repo("octo/two")));
            stubList("/repos/octo/one/commits", List.of(commit("a", "2024-01-01T10:00:00Z")));
            stubList("/repos/octo/two/commits", List.of(commit("b", "2024-01-03T10:00:00Z")));

            var commits = service.getCommits(encryptedToken, ActivityQuery.defaults()).await().indefinitely();

            assertEquals(List.of("b", "a"), commits.stream().map(c -> c.getString("sha")).toList());
        }

        @Test
        @DisplayName("should keep repository listing order for equal timestamps regardless of completion order")
        void shouldOrderTiesByRepositoryListing() {
            stubList("/user/repos", List.of(repo("octo/a"), repo("octo/b")));
            when(apiClient.getList(eq(TOKEN), eq("/repos/octo/a/pulls"), anyMap()))
                    .thenReturn(Uni.createFrom()
                            .item(List.of(updated(1, "2024-01-02T00:00:00Z"), updated(3, "2024-01-02T00:00:00Z")))
                            .onItem()
                            .delayIt()
                            .by(Duration.ofMillis(200)));
            stubList("/repos/octo/b/pulls", List.of(updated(2, "2024-01-02T00:00:00Z")));

            var prs = service.getPullRequests(encryptedToken, ActivityQuery.defaults()).await().indefinitely();

            assertEquals(List.of(1, 3, 2), prs.stream().map(pr -> pr.getInteger("id")).toList());
        }

        @Test
        @DisplayName("should page tied items consistently across requests")
        void shouldPageTiesConsistently() {
            stubList("/user/repos", List.of(repo("octo/a"), repo("octo/b")));
            when(apiClient.getList(eq(TOKEN), eq("/repos/octo/a/pulls"), anyMap()))
                    .thenReturn(Uni.createFrom()
                            .item(List.of(updated(1, "2024-01-02T00:00:00Z")))
                            .onItem()
                            .delayIt()
                            .by(Duration.ofMillis(100)));
            stubList("/repos/octo/b/pulls", List.of(updated(2, "2024-01-02T00:00:00Z")));

            var first = service.getPullRequests(encryptedToken, ActivityQuery.builder().page(1).perPage(1).build())
                    .await()
                    .indefinitely();
            var second = service.getPullRequests(encryptedToken, ActivityQuery.builder().page(2).perPage(1).build())
                    .await()
                    .indefinitely();

            assertEquals(1, first.get(0).getInteger("id"));
            assertEquals(2, second.get(0).getInteger("id"));
        }

        @Test
        @DisplayName("should merge commits from reachable repositories when one is unreachable")
        void shouldMergeCommitsSkippingUnreachableRepository() {
            stubList("/user/repos", List.of(repo("octo/one"), repo("octo/two"), repo("octo/three")));
            stubList(
                    "/repos/octo/one/commits",
                    List.of(commit("a1", "2024-01-04T10:00:00Z"), commit("a2", "2024-01-01T10:00:00Z")));
            when(apiClient.getList(eq(TOKEN), eq("/repos/octo/two/commits"), anyMap()))
                    .thenReturn(Uni.createFrom().failure(new UpstreamUnavailableException("Connection refused")));
            stubList(
                    "/repos/octo/three/commits",
                    List.of(commit("c1", "2024-01-03T10:00:00Z"), commit("c2", "2024-01-02T10:00:00Z")));

            var commits = service.getCommits(encryptedToken, ActivityQuery.defaults()).await().indefinitely();

            assertEquals(
                    List.of("a1", "c1", "c2", "a2"),
                    commits.stream().map(c -> c.getString("sha")).toList());
        }

        private JsonObject commit(String sha, String date) {
            return new JsonObject()
                    .put("sha", sha)
                    .put("commit", new JsonObject().put("author", new JsonObject().put("date", date)));
        }
    }

    @Nested
    @DisplayName("time windows")
    class TimeWindows {

        @Test
        @DisplayName("should include items exactly on the window bounds")
        void shouldIncludeBounds() {
            stubList(
                    "/repos/octo/one/pulls",
                    List.of(
                            updated(1, "2024-01-02T00:00:00Z"),
                            updated(2, "2024-01-01T23:59:59Z"),
                            updated(3, "2024-01-05T00:00:00Z"),
                            updated(4, "2024-01-05T00:00:01Z"),
                            new JsonObject().put("id", 5)));
            var query = ActivityQuery.builder()
                    .repo("octo/one")
                    .since(Instant.parse("2024-01-02T00:00:00Z"))
                    .until(Instant.parse("2024-01-05T00:00:00Z"))
                    .build();

            var prs = service.getPullRequests(encryptedToken, query).await().indefinitely();

            assertEquals(List.of(1, 3), prs.stream().map(pr -> pr.getInteger("id")).toList());
        }

        @Test
        @DisplayName("should pass commit windows and author to GitHub")
        void shouldPassCommitFiltersUpstream() {
            stubList("/repos/octo/one/commits", List.of());
            var query = ActivityQuery.builder()
                    .repo("octo/one")
                    .since(Instant.parse("2024-01-02T00:00:00Z"))
                    .until(Instant.parse("2024-01-05T00:00:00Z"))
                    .author("octocat")
                    .build();

            service.getCommits(encryptedToken, query).await().indefinitely();

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
            verify(apiClient).getList(eq(TOKEN), eq("/repos/octo/one/commits"), params.capture());
            assertEquals("2024-01-02T00:00:00Z", params.getValue().get("since"));
            assertEquals("2024-01-05T00:00:00Z", params.getValue().get("until"));
            assertEquals("octocat", params.getValue().get("author"));
        }
    }

    @Nested
    @DisplayName("issues and pushes")
    class IssuesAndPushes {

        @Test
        @DisplayName("should exclude pull requests from issues")
        void shouldExcludePullRequests() {
            stubList(
                    "/repos/octo/one/issues",
                    List.of(
                            updated(1, "2024-01-02T00:00:00Z"),
                            updated(2, "2024-01-03T00:00:00Z").put("pull_request", new JsonObject())));
            var query = ActivityQuery.builder().repo("octo/one").build();

            var issues = service.getIssues(encryptedToken, query).await().indefinitely();

            assertEquals(1, issues.size());
            assertEquals(1, issues.get(0).getInteger("id"));
        }

        @Test
        @DisplayName("should read pushes from the user's event stream")
        void shouldReadUserPushEvents() {
            when(apiClient.request(eq(TOKEN), eq("GET"), eq("/user"), anyMap()))
                    .thenReturn(Uni.createFrom().item(new JsonObject().put("login", "octocat")));
            stubList(
                    "/users/octocat/events/public",
                    List.of(
                            new JsonObject().put("type", "PushEvent").put("created_at", "2024-01-02T00:00:00Z"),
                            new JsonObject().put("type", "WatchEvent").put("created_at", "2024-01-02T00:00:00Z")));

            var pushes = service.getPushes(encryptedToken, ActivityQuery.defaults()).await().indefinitely();

            assertEquals(1, pushes.size());
            assertEquals("PushEvent", pushes.get(0).getString("type"));
        }

        @Test
        @DisplayName("should fail when the user profile has no login")
        void shouldFailWithoutLogin() {
            when(apiClient.request(eq(TOKEN), eq("GET"), eq("/user"), anyMap()))
                    .thenReturn(Uni.createFrom().item(new JsonObject().put("id", 42)));

            var pushes = service.getPushes(encryptedToken, ActivityQuery.defaults());

            assertThrows(UpstreamErrorException.class, () -> pushes.await().indefinitely());
            verify(apiClient, never()).getList(anyString(), anyString(), anyMap());
        }

        @Test
        @DisplayName("should read pushes from a repository's event stream")
        void shouldReadRepositoryPushEvents() {
            stubList(
                    "/repos/octo/one/events",
                    List.of(new JsonObject().put("type", "PushEvent").put("created_at", "2024-01-02T00:00:00Z")));

            var pushes = service.getPushes(encryptedToken, ActivityQuery.builder().repo("octo/one").build())
                    .await()
                    .indefinitely();

            assertEquals(1, pushes.size());
            verify(apiClient, never()).request(anyString(), anyString(), eq("/user"), anyMap());
        }
    }

    @Test
    @DisplayName("should summarize activity with counts and capped recent lists")
    void shouldSummarizeActivity() {
        var repos = new ArrayList<JsonObject>();
        for (int i = 0; i < 12; i++) {
            repos.add(repo("octo/repo-" + i));
        }
        when(apiClient.request(eq(TOKEN), eq("GET"), eq("/user"), anyMap()))
                .thenReturn(Uni.createFrom().item(new JsonObject().put("login", "octocat")));
        when(apiClient.getList(eq(TOKEN), anyString(), anyMap())).thenAnswer(invocation -> {
            String endpoint = invocation.getArgument(1);
            if (endpoint.equals("/user/repos")) {
                return Uni.createFrom().item(List.copyOf(repos));
            }
            if (endpoint.endsWith("/pulls") && endpoint.contains("repo-0")) {
                return Uni.createFrom().item(List.of(updated(7, "2024-01-02T00:00:00Z")));
            }
            return Uni.createFrom().item(List.<JsonObject>of());
        });

        var summary = service.getUserActivity(encryptedToken, Optional.empty(), Optional.empty())
                .await()
                .indefinitely();

        assertEquals(12, summary.totalRepositories());
        assertEquals(10, summary.repositoriesList().size());
        assertEquals("octo/repo-0", summary.repositoriesList().get(0).name());
        assertEquals(0, summary.totalPushes());
        assertEquals(1, summary.totalPullRequests());
        assertEquals(0, summary.totalIssues());
        assertEquals(0, summary.totalCommits());
        assertTrue(summary.recentIssues().isEmpty());
    }
}
