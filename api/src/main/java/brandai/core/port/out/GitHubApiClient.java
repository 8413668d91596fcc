package brandai.core.port.out;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

/**
 * Outbound port for authenticated GitHub REST API calls.
 *
 * <p>Failures are classified:
 * <ul>
 *   <li>403 mentioning a rate limit: {@link brandai.core.exception.RateLimitedException}</li>
 *   <li>401: {@link brandai.core.exception.InvalidCredentialException}</li>
 *   <li>other non-2xx: {@link brandai.core.exception.UpstreamErrorException}</li>
 *   <li>network failure or timeout: {@link brandai.core.exception.UpstreamUnavailableException}</li>
 * </ul>
 */
public interface GitHubApiClient {

    int MAX_PER_PAGE = 100;

    /**
     * Perform a request and decode the JSON body.
     *
     * @param accessToken plaintext GitHub token
     * @param method      HTTP method
     * @param endpoint    path relative to the API base URL, e.g. {@code /user/repos}
     * @param params      query parameters
     * @return a {@link JsonObject}, a {@link io.vertx.core.json.JsonArray}, or null for an empty body
     */
    Uni<Object> request(String accessToken, String method, String endpoint, Map<String, String> params);

    /**
     * GET an endpoint expected to return an array. A single object is returned as a one-element list.
     */
    Uni<List<JsonObject>> getList(String accessToken, String endpoint, Map<String, String> params);

    /**
     * GET an endpoint page by page with {@code per_page=100}.
     *
     * <p>Stops on an empty page, a page shorter than 100 items, or after {@code maxPages}.
     */
    Uni<List<JsonObject>> fetchAllPages(
            String accessToken, String endpoint, Map<String, String> params, int maxPages);
}
