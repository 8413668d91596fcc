package brandai.adapter.out.github;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import brandai.core.config.GitHubConfig;
import brandai.core.exception.BrandAiException;
import brandai.core.exception.ConfigurationException;
import brandai.core.exception.UpstreamUnavailableException;
import brandai.core.model.auth.DeviceFlowHandle;
import brandai.core.model.github.GitHubProfile;
import brandai.core.model.github.GitHubTokenResponse;
import brandai.core.model.user.GitHubUsage;
import brandai.core.port.out.GitHubOAuthClient;

/**
 * GitHub identity endpoints over the Vert.x web client.
 *
 * <p>Token requests are form posts with {@code Accept: application/json}. GitHub
 * reports token errors in a 200 body, which is returned as a
 * {@link GitHubTokenResponse}. Transport failures, timeouts and non-2xx
 * statuses become {@link UpstreamUnavailableException}.
 */
@ApplicationScoped
public class VertxGitHubOAuthClient implements GitHubOAuthClient {

    private static final Logger LOG = Logger.getLogger(VertxGitHubOAuthClient.class);

    static final String TOKEN_PATH = "/login/oauth/access_token";
    static final String DEVICE_CODE_PATH = "/login/device/code";
    static final String DEVICE_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:device_code";

    private final WebClient webClient;
    private final GitHubConfig config;

    @Inject
    public VertxGitHubOAuthClient(Vertx vertx, GitHubConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<GitHubTokenResponse> exchangeCode(String code) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", required(config.clientId(), "GitHub client id"));
        params.put("client_secret", required(config.clientSecret(), "GitHub client secret"));
        params.put("code", code);
        config.redirectUri().filter(uri -> !uri.isBlank()).ifPresent(uri -> params.put("redirect_uri", uri));

        LOG.debugf("Exchanging authorization code %s", truncate(code));
        return postForm(TOKEN_PATH, params, "token exchange").map(this::parseTokenResponse);
    }

    @Override
    public Uni<DeviceFlowHandle> requestDeviceCode() {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", required(config.deviceClientId(), "GitHub device client id"));
        params.put("scope", String.join(" ", config.scopes()));

        return postForm(DEVICE_CODE_PATH, params, "device code request").map(json -> {
            final var deviceCode = json.getString("device_code");
            if (deviceCode == null || deviceCode.isBlank()) {
                LOG.warnf("Device code response without device_code: %s", json.getString("error", "unknown"));
                throw new UpstreamUnavailableException("GitHub did not return a device code");
            }
            return new DeviceFlowHandle(
                    deviceCode,
                    json.getString("user_code"),
                    json.getString("verification_uri"),
                    json.getString("verification_uri_complete"),
                    json.getLong("expires_in", 900L),
                    json.getLong("interval", DeviceFlowHandle.DEFAULT_INTERVAL_SECONDS));
        });
    }

    @Override
    public Uni<GitHubTokenResponse> pollDeviceToken(String deviceCode) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", required(config.deviceClientId(), "GitHub device client id"));
        config.clientSecret().filter(s -> !s.isBlank()).ifPresent(secret -> params.put("client_secret", secret));
        params.put("device_code", deviceCode);
        params.put("grant_type", DEVICE_GRANT_TYPE);

        return postForm(TOKEN_PATH, params, "device token poll").map(this::parseTokenResponse);
    }

    @Override
    public Uni<GitHubTokenResponse> refreshToken(String refreshToken) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", required(config.clientId(), "GitHub client id"));
        params.put("client_secret", required(config.clientSecret(), "GitHub client secret"));
        params.put("grant_type", "refresh_token");
        params.put("refresh_token", refreshToken);

        return postForm(TOKEN_PATH, params, "token refresh").map(this::parseTokenResponse);
    }

    @Override
    public Uni<GitHubProfile> fetchProfile(String accessToken) {
        return webClient
                .getAbs(config.apiBaseUrl() + "/user")
                .timeout(config.oauthTimeout().toMillis())
                .putHeader("Authorization", "Bearer " + accessToken)
                .putHeader("Accept", "application/vnd.github.v3+json")
                .putHeader("User-Agent", config.userAgent())
                .send()
                .map(response -> parseProfile(requireSuccess(response, "profile fetch")))
                .onFailure(error -> !(error instanceof BrandAiException))
                .transform(error -> {
                    LOG.errorf(error, "GitHub profile fetch failed");
                    return new UpstreamUnavailableException("Failed to fetch GitHub user profile", error);
                });
    }

    private Uni<JsonObject> postForm(String path, Map<String, String> params, String operation) {
        return webClient
                .postAbs(config.oauthBaseUrl() + path)
                .timeout(config.oauthTimeout().toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .putHeader("User-Agent", config.userAgent())
                .sendBuffer(Buffer.buffer(buildFormBody(params)))
                .map(response -> requireSuccess(response, operation))
                .onFailure(error -> !(error instanceof BrandAiException))
                .transform(error -> {
                    LOG.errorf(error, "GitHub %s failed", operation);
                    return new UpstreamUnavailableException(
                            "GitHub " + operation + " failed: " + error.getMessage(), error);
                });
    }

    private JsonObject requireSuccess(HttpResponse<Buffer> response, String operation) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            LOG.warnf(
                    "GitHub %s failed with status %d: %s", operation, response.statusCode(), response.bodyAsString());
            throw new UpstreamUnavailableException(
                    "GitHub " + operation + " returned status " + response.statusCode());
        }
        try {
            final var json = response.bodyAsJsonObject();
            if (json == null) {
                throw new UpstreamUnavailableException("GitHub " + operation + " returned an empty body");
            }
            return json;
        } catch (RuntimeException e) {
            if (e instanceof BrandAiException brandAiException) {
                throw brandAiException;
            }
            LOG.errorf(e, "Failed to parse GitHub %s response", operation);
            throw new UpstreamUnavailableException("GitHub " + operation + " returned an unreadable body", e);
        }
    }

    private GitHubTokenResponse parseTokenResponse(JsonObject json) {
        final var expiresIn = json.getValue("expires_in") instanceof Number number
                ? Optional.of(number.longValue())
                : Optional.<Long>empty();
        return new GitHubTokenResponse(
                Optional.ofNullable(json.getString("access_token")),
                json.getString("token_type"),
                json.getString("scope"),
                Optional.ofNullable(json.getString("refresh_token")),
                expiresIn,
                Optional.ofNullable(json.getString("error")),
                json.getString("error_description"));
    }

    private GitHubProfile parseProfile(JsonObject json) {
        final var id = json.getLong("id");
        final var login = json.getString("login");
        if (id == null || login == null) {
            throw new UpstreamUnavailableException("GitHub profile is missing id or login");
        }
        return new GitHubProfile(
                id,
                login,
                json.getString("email"),
                json.getString("name"),
                json.getString("avatar_url"),
                new GitHubUsage(
                        json.getInteger("public_repos"),
                        json.getInteger("total_private_repos"),
                        json.getInteger("followers"),
                        json.getInteger("following")));
    }

    private static String required(Optional<String> value, String name) {
        return value.filter(v -> !v.isBlank())
                .orElseThrow(() -> new ConfigurationException(name + " is not configured"));
    }

    private static String buildFormBody(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .reduce((a, b) -> a + "&" + b)
                .orElse("");
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String truncate(String code) {
        return code.length() <= 8 ? code : code.substring(0, 8) + "...";
    }
}
