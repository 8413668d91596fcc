package brandai.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import brandai.core.config.GitHubConfig;
import brandai.core.config.OAuthStateConfig;
import brandai.core.exception.ConfigurationException;
import brandai.core.exception.DeviceCodeExpiredException;
import brandai.core.exception.DeviceFlowTimeoutException;
import brandai.core.exception.InvalidCredentialException;
import brandai.core.exception.InvalidStateException;
import brandai.core.exception.InvalidTokenException;
import brandai.core.exception.UpstreamAuthException;
import brandai.core.model.github.GitHubProfile;
import brandai.core.model.github.GitHubTokenResponse;
import brandai.core.model.user.GitHubUsage;
import brandai.core.model.user.ProviderCredentials;
import brandai.core.model.user.UserAccount;
import brandai.core.port.out.GitHubOAuthClient;
import brandai.core.port.out.OAuthStateRepository;
import brandai.core.port.out.PollingTimer;
import brandai.core.service.session.SessionTokenIssuer;
import brandai.core.service.user.UserAccountService;

@DisplayName("OAuthFlowService")
class OAuthFlowServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final GitHubProfile PROFILE =
            new GitHubProfile(4242L, "octocat", "octo@example.com", "The Octocat", null, GitHubUsage.empty());

    private GitHubConfig config;
    private GitHubConfig.DeviceFlowConfig deviceConfig;
    private OAuthStateConfig stateConfig;
    private GitHubOAuthClient oauthClient;
    private OAuthStateRepository stateRepository;
    private TokenCipher tokenCipher;
    private SessionTokenIssuer sessionTokenIssuer;
    private UserAccountService userAccountService;
    private PollingTimer pollingTimer;
    private OAuthFlowService service;

    @BeforeEach
    void setUp() {
        config = mock(GitHubConfig.class);
        deviceConfig = mock(GitHubConfig.DeviceFlowConfig.class);
        stateConfig = mock(OAuthStateConfig.class);
        oauthClient = mock(GitHubOAuthClient.class);
        stateRepository = mock(OAuthStateRepository.class);
        userAccountService = mock(UserAccountService.class);
        pollingTimer = mock(PollingTimer.class);

        when(config.clientId()).thenReturn(Optional.of("client-123"));
        when(config.clientSecret()).thenReturn(Optional.of("secret-456"));
        when(config.redirectUri()).thenReturn(Optional.of("http://localhost:8000/auth/github/callback"));
        when(config.deviceClientId()).thenReturn(Optional.of("device-789"));
        when(config.scopes()).thenReturn(List.of("repo", "read:org", "read:user"));
        when(config.oauthBaseUrl()).thenReturn("https://github.com");
        when(config.device()).thenReturn(deviceConfig);
        when(deviceConfig.maxAttempts()).thenReturn(20);
        when(deviceConfig.defaultInterval()).thenReturn(Duration.ofSeconds(5));
        when(deviceConfig.slowDownIncrement()).thenReturn(Duration.ofSeconds(5));
        when(stateConfig.enforce()).thenReturn(false);
        when(stateConfig.ttl()).thenReturn(Duration.ofMinutes(10));

        when(pollingTimer.sleep(any())).thenReturn(Uni.createFrom().voidItem());
        when(oauthClient.fetchProfile(anyString())).thenReturn(Uni.createFrom().item(PROFILE));
        when(userAccountService.upsertFromGitHub(any(), any())).thenAnswer(invocation -> {
            GitHubProfile profile = invocation.getArgument(0);
            ProviderCredentials credentials = invocation.getArgument(1);
            return Uni.createFrom().item(UserAccount.create(profile, credentials, NOW).withId("user-1"));
        });

        var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        tokenCipher = new TokenCipher(Optional.of("encryption-secret"), TokenCipher.MIN_ITERATIONS);
        sessionTokenIssuer = new SessionTokenIssuer(
                Optional.of("session-secret-for-oauth-flow-tests-0123456789"), "HS256", 24, clock);

        service = new OAuthFlowService(
                config,
                stateConfig,
                oauthClient,
                stateRepository,
                tokenCipher,
                sessionTokenIssuer,
                userAccountService,
                pollingTimer,
                clock);
    }

    private static Uni<GitHubTokenResponse> pending() {
        return Uni.createFrom().item(GitHubTokenResponse.error(OAuthFlowService.AUTHORIZATION_PENDING, null));
    }

    private static Uni<GitHubTokenResponse> granted(String accessToken) {
        return Uni.createFrom().item(GitHubTokenResponse.success(accessToken));
    }

    @Nested
    @DisplayName("initiateAuthorizationFlow")
    class InitiateAuthorizationFlow {

        @Test
        @DisplayName("should build the authorize URL with encoded parameters")
        void shouldBuildAuthorizeUrl() {
            var request = service.initiateAuthorizationFlow(Optional.of("my-state"))
                    .await()
                    .indefinitely();

            assertEquals("my-state", request.state());
            assertEquals(
                    "https://github.com/login/oauth/authorize?client_id=client-123"
                            + "&redirect_uri=http%3A%2F%2Flocalhost%3A8000%2Fauth%2Fgithub%2Fcallback"
                            + "&scope=repo+read%3Aorg+read%3Auser"
                            + "&state=my-state",
                    request.authorizationUrl());
        }

        @Test
        @DisplayName("should generate a random state when none is supplied")
        void shouldGenerateState() {
            var first = service.initiateAuthorizationFlow(Optional.empty()).await().indefinitely();
            var second = service.initiateAuthorizationFlow(Optional.empty()).await().indefinitely();

            assertEquals(43, first.state().length());
            assertFalse(first.state().equals(second.state()));
            assertTrue(first.authorizationUrl().endsWith("&state=" + first.state()));
        }

        @Test
        @DisplayName("should omit redirect_uri when not configured")
        void shouldOmitRedirectUri() {
            when(config.redirectUri()).thenReturn(Optional.empty());

            var request = service.initiateAuthorizationFlow(Optional.of("s")).await().indefinitely();

            assertFalse(request.authorizationUrl().contains("redirect_uri"));
        }

        @Test
        @DisplayName("should store the state when state enforcement is on")
        void shouldStoreStateWhenEnforced() {
            when(stateConfig.enforce()).thenReturn(true);
            when(stateRepository.store(anyString(), any())).thenReturn(Uni.createFrom().voidItem());

            service.initiateAuthorizationFlow(Optional.of("tracked")).await().indefinitely();

            verify(stateRepository).store("tracked", Duration.ofMinutes(10));
        }

        @Test
        @DisplayName("should fail with a configuration error when client id is missing")
        void shouldFailWithoutClientId() {
            when(config.clientId()).thenReturn(Optional.empty());

            assertThrows(ConfigurationException.class, () -> service.initiateAuthorizationFlow(Optional.empty()));
        }
    }

    @Nested
    @DisplayName("completeAuthorizationFlow")
    class CompleteAuthorizationFlow {

        @Test
        @DisplayName("should exchange the code and issue a session for the user")
        void shouldIssueSession() {
            when(oauthClient.exchangeCode("code-1")).thenReturn(granted("gho_user_token"));

            var session = service.completeAuthorizationFlow("code-1", "state").await().indefinitely();

            assertEquals("Bearer", session.tokenType());
            assertEquals(86_400, session.expiresIn());
            assertEquals("user-1", session.user().id());
            assertEquals(4242L, session.user().githubId());
            assertEquals("user-1", sessionTokenIssuer.verify(session.accessToken()).subject());
            verify(oauthClient).fetchProfile("gho_user_token");
        }

        @Test
        @DisplayName("should store the access token encrypted")
        void shouldEncryptAccessToken() {
            when(oauthClient.exchangeCode("code-1")).thenReturn(granted("gho_user_token"));

            service.completeAuthorizationFlow("code-1", null).await().indefinitely();

            var captor = ArgumentCaptor.forClass(ProviderCredentials.class);
            verify(userAccountService).upsertFromGitHub(eq(PROFILE), captor.capture());
            var credentials = captor.getValue();
            assertFalse(credentials.encryptedAccessToken().contains("gho_user_token"));
            assertEquals("gho_user_token", tokenCipher.decrypt(credentials.encryptedAccessToken()));
            assertNull(credentials.encryptedRefreshToken());
            assertNull(credentials.expiresAt());
        }

        @Test
        @DisplayName("should record refresh token and expiry for expiring tokens")
        void shouldKeepRefreshTokenAndExpiry() {
            var response = new GitHubTokenResponse(
                    Optional.of("ghu_expiring"),
                    "bearer",
                    "repo",
                    Optional.of("ghr_refresh"),
                    Optional.of(28_800L),
                    Optional.empty(),
                    null);
            when(oauthClient.exchangeCode("code-1")).thenReturn(Uni.createFrom().item(response));

            service.completeAuthorizationFlow("code-1", null).await().indefinitely();

            var captor = ArgumentCaptor.forClass(ProviderCredentials.class);
            verify(userAccountService).upsertFromGitHub(any(), captor.capture());
            assertEquals(NOW.plusSeconds(28_800), captor.getValue().expiresAt());
            assertEquals("ghr_refresh", tokenCipher.decrypt(captor.getValue().encryptedRefreshToken()));
        }

        @Test
        @DisplayName("should surface GitHub errors as upstream auth errors")
        void shouldFailOnGitHubError() {
            when(oauthClient.exchangeCode("bad"))
                    .thenReturn(Uni.createFrom()
                            .item(GitHubTokenResponse.error(
                                    "bad_verification_code", "The code passed is incorrect or expired.")));

            var error = assertThrows(
                    UpstreamAuthException.class,
                    () -> service.completeAuthorizationFlow("bad", null).await().indefinitely());
            assertTrue(error.getMessage().contains("incorrect or expired"));
            verify(userAccountService, never()).upsertFromGitHub(any(), any());
        }

        @Test
        @DisplayName("should reject a blank code")
        void shouldRejectBlankCode() {
            assertThrows(IllegalArgumentException.class, () -> service.completeAuthorizationFlow(" ", null));
        }

        @Test
        @DisplayName("should fail with a configuration error when client secret is missing")
        void shouldFailWithoutClientSecret() {
            when(config.clientSecret()).thenReturn(Optional.empty());

            assertThrows(ConfigurationException.class, () -> service.completeAuthorizationFlow("code", null));
        }

        @Test
        @DisplayName("should reject an unknown state when enforcement is on")
        void shouldRejectUnknownState() {
            when(stateConfig.enforce()).thenReturn(true);
            when(stateRepository.consume("forged")).thenReturn(Uni.createFrom().item(false));

            assertThrows(
                    InvalidStateException.class,
                    () -> service.completeAuthorizationFlow("code", "forged").await().indefinitely());
            verify(oauthClient, never()).exchangeCode(anyString());
        }

        @Test
        @DisplayName("should reject a missing state when enforcement is on")
        void shouldRejectMissingState() {
            when(stateConfig.enforce()).thenReturn(true);

            assertThrows(
                    InvalidStateException.class,
                    () -> service.completeAuthorizationFlow("code", null).await().indefinitely());
        }

        @Test
        @DisplayName("should accept an issued state when enforcement is on")
        void shouldAcceptIssuedState() {
            when(stateConfig.enforce()).thenReturn(true);
            when(stateRepository.consume("issued")).thenReturn(Uni.createFrom().item(true));
            when(oauthClient.exchangeCode("code")).thenReturn(granted("gho_token"));

            var session = service.completeAuthorizationFlow("code", "issued").await().indefinitely();

            assertEquals("user-1", session.user().id());
        }
    }

    @Nested
    @DisplayName("completeDeviceFlow")
    class CompleteDeviceFlow {

        @Test
        @DisplayName("should wait the interval between pending polls")
        void shouldWaitBetweenPendingPolls() {
            when(oauthClient.pollDeviceToken("dc")).thenReturn(pending(), pending(), pending(), granted("gho_device"));

            var session = service.completeDeviceFlow("dc", "ABCD-1234", Optional.empty())
                    .await()
                    .indefinitely();

            assertEquals("user-1", session.user().id());
            verify(oauthClient, times(4)).pollDeviceToken("dc");
            verify(pollingTimer, times(3)).sleep(Duration.ofSeconds(5));
            verify(oauthClient).fetchProfile("gho_device");
        }

        @Test
        @DisplayName("should use the caller supplied interval")
        void shouldUseSuppliedInterval() {
            when(oauthClient.pollDeviceToken("dc")).thenReturn(pending(), granted("gho_device"));

            service.completeDeviceFlow("dc", "ABCD-1234", Optional.of(Duration.ofSeconds(2)))
                    .await()
                    .indefinitely();

            verify(pollingTimer).sleep(Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("should grow the interval on slow_down")
        void shouldGrowIntervalOnSlowDown() {
            when(oauthClient.pollDeviceToken("dc"))
                    .thenReturn(
                            Uni.createFrom().item(GitHubTokenResponse.error(OAuthFlowService.SLOW_DOWN, null)),
                            pending(),
                            granted("gho_device"));

            service.completeDeviceFlow("dc", "ABCD-1234", Optional.empty()).await().indefinitely();

            verify(pollingTimer, times(2)).sleep(Duration.ofSeconds(10));
            verify(pollingTimer, never()).sleep(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should time out after the maximum number of attempts")
        void shouldTimeOutAfterMaxAttempts() {
            when(oauthClient.pollDeviceToken("dc")).thenReturn(pending());

            assertThrows(
                    DeviceFlowTimeoutException.class,
                    () -> service.completeDeviceFlow("dc", "ABCD-1234", Optional.empty())
                            .await()
                            .indefinitely());
            verify(oauthClient, times(20)).pollDeviceToken("dc");
            verify(pollingTimer, times(19)).sleep(any());
        }

        @Test
        @DisplayName("should fail without waiting when the device code expired")
        void shouldFailOnExpiredCode() {
            when(oauthClient.pollDeviceToken("dc"))
                    .thenReturn(Uni.createFrom().item(GitHubTokenResponse.error(OAuthFlowService.EXPIRED_TOKEN, null)));

            assertThrows(
                    DeviceCodeExpiredException.class,
                    () -> service.completeDeviceFlow("dc", "ABCD-1234", Optional.empty())
                            .await()
                            .indefinitely());
            verify(pollingTimer, never()).sleep(any());
        }

        @Test
        @DisplayName("should fail when the user denies access")
        void shouldFailOnAccessDenied() {
            when(oauthClient.pollDeviceToken("dc"))
                    .thenReturn(Uni.createFrom()
                            .item(GitHubTokenResponse.error("access_denied", "The user has denied your application")));

            var error = assertThrows(
                    UpstreamAuthException.class,
                    () -> service.completeDeviceFlow("dc", "ABCD-1234", Optional.empty())
                            .await()
                            .indefinitely());
            assertTrue(error.getMessage().contains("denied"));
        }

        @Test
        @DisplayName("should reject a blank device code")
        void shouldRejectBlankDeviceCode() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.completeDeviceFlow("", "ABCD-1234", Optional.empty()));
        }

        @Test
        @DisplayName("should fail with a configuration error when device client id is missing")
        void shouldFailWithoutDeviceClientId() {
            when(config.deviceClientId()).thenReturn(Optional.empty());

            assertThrows(ConfigurationException.class, () -> service.initiateDeviceFlow());
            assertThrows(
                    ConfigurationException.class,
                    () -> service.completeDeviceFlow("dc", "ABCD-1234", Optional.empty()));
        }
    }

    @Nested
    @DisplayName("refreshProviderToken")
    class RefreshProviderToken {

        @Test
        @DisplayName("should reject users without a refresh token")
        void shouldRejectWithoutRefreshToken() {
            var account = UserAccount.builder(4242L)
                    .id("user-1")
                    .username("octocat")
                    .encryptedAccessToken(tokenCipher.encrypt("gho_old"))
                    .build();
            when(userAccountService.findById("user-1")).thenReturn(Uni.createFrom().item(Optional.of(account)));

            assertThrows(
                    InvalidCredentialException.class,
                    () -> service.refreshProviderToken("user-1").await().indefinitely());
            verify(oauthClient, never()).refreshToken(anyString());
        }

        @Test
        @DisplayName("should exchange the decrypted refresh token and store new credentials")
        void shouldRefreshAndStore() {
            var account = UserAccount.builder(4242L)
                    .id("user-1")
                    .username("octocat")
                    .encryptedAccessToken(tokenCipher.encrypt("ghu_old"))
                    .encryptedRefreshToken(tokenCipher.encrypt("ghr_old"))
                    .build();
            when(userAccountService.findById("user-1")).thenReturn(Uni.createFrom().item(Optional.of(account)));
            when(oauthClient.refreshToken("ghr_old")).thenReturn(granted("ghu_new"));
            when(userAccountService.replaceCredentials(any(), any())).thenAnswer(invocation -> {
                ProviderCredentials credentials = invocation.getArgument(1);
                return Uni.createFrom().item(account.withCredentials(credentials, NOW));
            });

            var refreshed = service.refreshProviderToken("user-1").await().indefinitely();

            assertEquals("ghu_new", tokenCipher.decrypt(refreshed.encryptedAccessToken()));
            assertEquals("ghr_old", tokenCipher.decrypt(refreshed.encryptedRefreshToken()));
        }

        @Test
        @DisplayName("should reject unknown users")
        void shouldRejectUnknownUser() {
            when(userAccountService.findById("ghost")).thenReturn(Uni.createFrom().item(Optional.empty()));

            assertThrows(
                    InvalidTokenException.class,
                    () -> service.refreshProviderToken("ghost").await().indefinitely());
        }
    }
}
