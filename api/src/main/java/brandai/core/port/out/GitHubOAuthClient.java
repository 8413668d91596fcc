package brandai.core.port.out;

import io.smallrye.mutiny.Uni;

import brandai.core.model.auth.DeviceFlowHandle;
import brandai.core.model.github.GitHubProfile;
import brandai.core.model.github.GitHubTokenResponse;

/**
 * Outbound port for the GitHub identity endpoints.
 *
 * <p>Token endpoint error bodies are returned as {@link GitHubTokenResponse}
 * values, not failures. Transport failures and non-2xx statuses fail with
 * {@link brandai.core.exception.UpstreamUnavailableException}.
 */
public interface GitHubOAuthClient {

    /**
     * Exchange an authorization code for an access token.
     */
    Uni<GitHubTokenResponse> exchangeCode(String code);

    /**
     * Start a device flow.
     */
    Uni<DeviceFlowHandle> requestDeviceCode();

    /**
     * Poll the token endpoint once for a device code.
     */
    Uni<GitHubTokenResponse> pollDeviceToken(String deviceCode);

    /**
     * Redeem a refresh token for a new access token.
     */
    Uni<GitHubTokenResponse> refreshToken(String refreshToken);

    /**
     * Fetch the profile of the user owning the access token.
     */
    Uni<GitHubProfile> fetchProfile(String accessToken);
}
