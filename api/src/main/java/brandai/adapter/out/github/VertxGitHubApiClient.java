package brandai.adapter.out.github;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import brandai.core.config.GitHubConfig;
import brandai.core.exception.BrandAiException;
import brandai.core.exception.InvalidCredentialException;
import brandai.core.exception.RateLimitedException;
import brandai.core.exception.UpstreamErrorException;
import brandai.core.exception.UpstreamUnavailableException;
import brandai.core.model.github.GitHubRequestOutcome;
import brandai.core.port.out.GitHubApiClient;
import brandai.core.port.out.GitHubApiMetrics;

/**
 * GitHub REST API client over the Vert.x web client.
 *
 * <p>Rate limiting is reported, never retried. Every call is bounded by
 * {@code brandai.github.api-timeout}.
 */
@ApplicationScoped
public class VertxGitHubApiClient implements GitHubApiClient {

    private static final Logger LOG = Logger.getLogger(VertxGitHubApiClient.class);

    private static final String ACCEPT = "application/vnd.github.v3+json";

    private final WebClient webClient;
    private final GitHubConfig config;
    private final GitHubApiMetrics metrics;

    @Inject
    public VertxGitHubApiClient(Vertx vertx, GitHubConfig config, GitHubApiMetrics metrics) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<Object> request(String accessToken, String method, String endpoint, Map<String, String> params) {
        final long start = System.nanoTime();

        HttpRequest<Buffer> request = webClient
                .requestAbs(HttpMethod.valueOf(method.toUpperCase(Locale.ROOT)), config.apiBaseUrl() + endpoint)
                .timeout(config.apiTimeout().toMillis())
                .putHeader("Authorization", "Bearer " + accessToken)
                .putHeader("Accept", ACCEPT)
                .putHeader("User-Agent", config.userAgent());
        for (Map.Entry<String, String> param : params.entrySet()) {
            request = request.addQueryParam(param.getKey(), param.getValue());
        }

        return request.send()
                .map(response -> classify(response, method, endpoint))
                .invoke(body -> metrics.recordRequest(GitHubRequestOutcome.SUCCESS, elapsedMs(start)))
                .onFailure(BrandAiException.class)
                .invoke(error -> metrics.recordRequest(outcomeOf((BrandAiException) error), elapsedMs(start)))
                .onFailure(error -> !(error instanceof BrandAiException))
                .transform(error -> {
                    LOG.errorf(error, "GitHub API %s %s failed", method, endpoint);
                    metrics.recordRequest(GitHubRequestOutcome.UNAVAILABLE, elapsedMs(start));
                    return new UpstreamUnavailableException("GitHub API unavailable: " + error.getMessage(), error);
                });
    }

    @Override
    public Uni<List<JsonObject>> getList(String accessToken, String endpoint, Map<String, String> params) {
        return request(accessToken, "GET", endpoint, params).map(VertxGitHubApiClient::toObjectList);
    }

    @Override
    public Uni<List<JsonObject>> fetchAllPages(
            String accessToken, String endpoint, Map<String, String> params, int maxPages) {
        return fetchPage(accessToken, endpoint, params, 1, maxPages, new ArrayList<>());
    }

    private Uni<List<JsonObject>> fetchPage(
            String accessToken,
            String endpoint,
            Map<String, String> params,
            int page,
            int maxPages,
            List<JsonObject> accumulated) {
        if (page > maxPages) {
            return Uni.createFrom().item(accumulated);
        }

        final Map<String, String> pageParams = new LinkedHashMap<>(params);
        pageParams.put("page", String.valueOf(page));
        pageParams.put("per_page", String.valueOf(MAX_PER_PAGE));

        return getList(accessToken, endpoint, pageParams).flatMap(items -> {
            accumulated.addAll(items);
            if (items.size() < MAX_PER_PAGE) {
                LOG.debugf("Fetched %d item(s) from %s in %d page(s)", (Object) accumulated.size(), endpoint, page);
                return Uni.createFrom().item(accumulated);
            }
            return fetchPage(accessToken, endpoint, params, page + 1, maxPages, accumulated);
        });
    }

    private Object classify(HttpResponse<Buffer> response, String method, String endpoint) {
        final int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return decode(response.bodyAsString());
        }

        final String body = response.bodyAsString();
        if (status == 403 && body != null && body.toLowerCase(Locale.ROOT).contains("rate limit")) {
            LOG.warnf("GitHub API rate limit exceeded on %s %s", method, endpoint);
            throw new RateLimitedException("GitHub API rate limit exceeded");
        }
        if (status == 401) {
            LOG.warnf("GitHub rejected the access token on %s %s", method, endpoint);
            throw new InvalidCredentialException("Invalid or expired GitHub token");
        }
        LOG.errorf("GitHub API %s %s returned status %d: %s", method, endpoint, status, body);
        throw new UpstreamErrorException(status, "GitHub API error: " + status);
    }

    private static Object decode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return Json.decodeValue(body);
        } catch (DecodeException e) {
            throw new UpstreamUnavailableException("GitHub API returned an unreadable body", e);
        }
    }

    private static List<JsonObject> toObjectList(Object body) {
        if (body == null) {
            return List.of();
        }
        if (body instanceof JsonArray array) {
            final List<JsonObject> items = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                final Object item = array.getValue(i);
                if (item instanceof JsonObject object) {
                    items.add(object);
                }
            }
            return items;
        }
        if (body instanceof JsonObject object) {
            return List.of(object);
        }
        return List.of();
    }

    private static GitHubRequestOutcome outcomeOf(BrandAiException error) {
        return switch (error.kind()) {
            case RATE_LIMITED -> GitHubRequestOutcome.RATE_LIMITED;
            case INVALID_CREDENTIAL -> GitHubRequestOutcome.UNAUTHORIZED;
            case UPSTREAM_UNAVAILABLE -> GitHubRequestOutcome.UNAVAILABLE;
            default -> GitHubRequestOutcome.ERROR;
        };
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
