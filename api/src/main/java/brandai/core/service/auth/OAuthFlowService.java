package brandai.core.service.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import brandai.core.config.GitHubConfig;
import brandai.core.config.OAuthStateConfig;
import brandai.core.exception.ConfigurationException;
import brandai.core.exception.DeviceCodeExpiredException;
import brandai.core.exception.DeviceFlowTimeoutException;
import brandai.core.exception.InvalidCredentialException;
import brandai.core.exception.InvalidStateException;
import brandai.core.exception.InvalidTokenException;
import brandai.core.exception.UpstreamAuthException;
import brandai.core.model.auth.AuthorizationRequest;
import brandai.core.model.auth.DeviceFlowHandle;
import brandai.core.model.auth.SessionIssued;
import brandai.core.model.github.GitHubTokenResponse;
import brandai.core.model.user.ProviderCredentials;
import brandai.core.model.user.UserAccount;
import brandai.core.model.user.UserSummary;
import brandai.core.port.in.OAuthFlowManagement;
import brandai.core.port.out.GitHubOAuthClient;
import brandai.core.port.out.OAuthStateRepository;
import brandai.core.port.out.PollingTimer;
import brandai.core.service.session.SessionTokenIssuer;
import brandai.core.service.user.UserAccountService;

/**
 * Drives the GitHub authorization-code and device flows.
 *
 * <p>Device polling is a chain of non-blocking waits:
 * <ul>
 *   <li>{@code authorization_pending}: wait the current interval and poll again</li>
 *   <li>{@code slow_down}: grow the interval, wait and poll again</li>
 *   <li>{@code expired_token}: fail with {@link DeviceCodeExpiredException}</li>
 *   <li>any other error: fail with {@link UpstreamAuthException}</li>
 * </ul>
 * Polling stops after the configured number of attempts, with no wait after the last one.
 */
@ApplicationScoped
public class OAuthFlowService implements OAuthFlowManagement {

    private static final Logger LOG = Logger.getLogger(OAuthFlowService.class);

    static final String AUTHORIZATION_PENDING = "authorization_pending";
    static final String SLOW_DOWN = "slow_down";
    static final String EXPIRED_TOKEN = "expired_token";

    private static final int STATE_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final GitHubConfig config;
    private final OAuthStateConfig stateConfig;
    private final GitHubOAuthClient oauthClient;
    private final OAuthStateRepository stateRepository;
    private final TokenCipher tokenCipher;
    private final SessionTokenIssuer sessionTokenIssuer;
    private final UserAccountService userAccountService;
    private final PollingTimer pollingTimer;
    private final Clock clock;

    @Inject
    public OAuthFlowService(
            GitHubConfig config,
            OAuthStateConfig stateConfig,
            GitHubOAuthClient oauthClient,
            OAuthStateRepository stateRepository,
            TokenCipher tokenCipher,
            SessionTokenIssuer sessionTokenIssuer,
            UserAccountService userAccountService,
            PollingTimer pollingTimer,
            Clock clock) {
        this.config = config;
        this.stateConfig = stateConfig;
        this.oauthClient = oauthClient;
        this.stateRepository = stateRepository;
        this.tokenCipher = tokenCipher;
        this.sessionTokenIssuer = sessionTokenIssuer;
        this.userAccountService = userAccountService;
        this.pollingTimer = pollingTimer;
        this.clock = clock;
    }

    @Override
    public Uni<AuthorizationRequest> initiateAuthorizationFlow(Optional<String> requestedState) {
        final String clientId = requireConfigured(config.clientId(), "GitHub client id");
        final String state = requestedState.filter(s -> !s.isBlank()).orElseGet(OAuthFlowService::generateState);

        final Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", clientId);
        config.redirectUri().filter(uri -> !uri.isBlank()).ifPresent(uri -> params.put("redirect_uri", uri));
        params.put("scope", scope());
        params.put("state", state);

        final String url = config.oauthBaseUrl() + "/login/oauth/authorize?" + toQuery(params);
        final var request = new AuthorizationRequest(url, state);

        if (!stateConfig.enforce()) {
            return Uni.createFrom().item(request);
        }
        return stateRepository.store(state, stateConfig.ttl()).replaceWith(request);
    }

    @Override
    public Uni<SessionIssued> completeAuthorizationFlow(String code, String state) {
        requireConfigured(config.clientId(), "GitHub client id");
        requireConfigured(config.clientSecret(), "GitHub client secret");
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Authorization code is required");
        }

        return verifyState(state)
                .flatMap(v -> oauthClient.exchangeCode(code))
                .map(this::requireAccessToken)
                .flatMap(this::signIn)
                .invoke(session -> LOG.infof(
                        "Authorization-code flow completed for user %s", session.user().id()));
    }

    @Override
    public Uni<DeviceFlowHandle> initiateDeviceFlow() {
        requireConfigured(config.deviceClientId(), "GitHub device client id");
        return oauthClient
                .requestDeviceCode()
                .invoke(handle -> LOG.infof(
                        "Device flow initiated, user code %s, interval %ds", handle.userCode(), handle.interval()));
    }

    @Override
    public Uni<SessionIssued> completeDeviceFlow(String deviceCode, String userCode, Optional<Duration> interval) {
        requireConfigured(config.deviceClientId(), "GitHub device client id");
        if (deviceCode == null || deviceCode.isBlank()) {
            throw new IllegalArgumentException("Device code is required");
        }

        final Duration initialInterval = interval.filter(i -> !i.isNegative() && !i.isZero())
                .orElse(config.device().defaultInterval());
        LOG.debugf("Polling device flow for user code %s every %s", userCode, initialInterval);

        return poll(deviceCode, 1, initialInterval)
                .flatMap(this::signIn)
                .invoke(session -> LOG.infof("Device flow completed for user %s", session.user().id()));
    }

    @Override
    public Uni<UserAccount> refreshProviderToken(String userId) {
        requireConfigured(config.clientId(), "GitHub client id");
        requireConfigured(config.clientSecret(), "GitHub client secret");

        return userAccountService
                .findById(userId)
                .map(account -> account.orElseThrow(() -> new InvalidTokenException("User not found")))
                .flatMap(account -> {
                    if (!account.hasRefreshToken()) {
                        throw new InvalidCredentialException(
                                "No GitHub refresh token stored for this user; sign in again");
                    }
                    final String refreshToken = tokenCipher.decrypt(account.encryptedRefreshToken());
                    return oauthClient
                            .refreshToken(refreshToken)
                            .map(this::requireAccessToken)
                            .map(this::encryptCredentials)
                            .flatMap(credentials -> userAccountService.replaceCredentials(account, credentials));
                })
                .invoke(account -> LOG.infof("Refreshed GitHub token for user %s", account.id()));
    }

    private Uni<GitHubTokenResponse> poll(String deviceCode, int attempt, Duration interval) {
        return oauthClient.pollDeviceToken(deviceCode).flatMap(response -> {
            if (!response.isError()) {
                LOG.debugf("Device flow authorized after %d attempt(s)", attempt);
                return Uni.createFrom().item(requireAccessToken(response));
            }

            final String error = response.error().get();
            switch (error) {
                case AUTHORIZATION_PENDING:
                    return retry(deviceCode, attempt, interval);
                case SLOW_DOWN:
                    final Duration slower = interval.plus(config.device().slowDownIncrement());
                    LOG.debugf("GitHub asked to slow down, polling every %s", slower);
                    return retry(deviceCode, attempt, slower);
                case EXPIRED_TOKEN:
                    return Uni.createFrom()
                            .failure(new DeviceCodeExpiredException(
                                    "Device code expired. Please restart the device flow."));
                default:
                    LOG.warnf("Device flow rejected by GitHub: %s", error);
                    return Uni.createFrom()
                            .failure(new UpstreamAuthException(
                                    "Device verification failed: " + response.errorMessage()));
            }
        });
    }

    private Uni<GitHubTokenResponse> retry(String deviceCode, int attempt, Duration interval) {
        final int maxAttempts = config.device().maxAttempts();
        if (attempt >= maxAttempts) {
            LOG.warnf("Device flow timed out after %d attempts", maxAttempts);
            return Uni.createFrom()
                    .failure(new DeviceFlowTimeoutException(
                            "Device verification timed out after " + maxAttempts + " attempts"));
        }
        return pollingTimer.sleep(interval).flatMap(v -> poll(deviceCode, attempt + 1, interval));
    }

    private Uni<Void> verifyState(String state) {
        if (!stateConfig.enforce()) {
            return Uni.createFrom().voidItem();
        }
        if (state == null || state.isBlank()) {
            return Uni.createFrom().failure(new InvalidStateException("OAuth state is missing"));
        }
        return stateRepository.consume(state).flatMap(valid -> valid
                ? Uni.createFrom().voidItem()
                : Uni.createFrom().failure(new InvalidStateException("OAuth state is unknown or already used")));
    }

    private Uni<SessionIssued> signIn(GitHubTokenResponse tokens) {
        final String accessToken = tokens.accessToken().get();
        return oauthClient.fetchProfile(accessToken).flatMap(profile -> {
            final ProviderCredentials credentials = encryptCredentials(tokens);
            return userAccountService.upsertFromGitHub(profile, credentials);
        }).map(this::issueSession);
    }

    private SessionIssued issueSession(UserAccount account) {
        final String token = sessionTokenIssuer.issue(account.id());
        return SessionIssued.bearer(token, sessionTokenIssuer.expiresInSeconds(), UserSummary.from(account));
    }

    private ProviderCredentials encryptCredentials(GitHubTokenResponse tokens) {
        final String encryptedAccess = tokenCipher.encrypt(tokens.accessToken().get());
        final String encryptedRefresh = tokens.refreshToken().map(tokenCipher::encrypt).orElse(null);
        final var expiresAt = tokens.expiresIn()
                .map(seconds -> clock.instant().plusSeconds(seconds))
                .orElse(null);
        return new ProviderCredentials(encryptedAccess, expiresAt, encryptedRefresh);
    }

    private GitHubTokenResponse requireAccessToken(GitHubTokenResponse response) {
        if (response.isError() || response.accessToken().isEmpty()) {
            LOG.warnf("GitHub token request failed: %s", response.error().orElse("no access token"));
            throw new UpstreamAuthException("GitHub OAuth error: " + response.errorMessage());
        }
        return response;
    }

    private String scope() {
        return String.join(" ", config.scopes());
    }

    private static String requireConfigured(Optional<String> value, String name) {
        return value.filter(v -> !v.isBlank())
                .orElseThrow(() -> new ConfigurationException(name + " is not configured"));
    }

    private static String toQuery(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /**
     * Generate a cryptographically random CSRF state.
     *
     * @return 32 random bytes, Base64URL encoded without padding
     */
    static String generateState() {
        final byte[] randomBytes = new byte[STATE_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }
}
