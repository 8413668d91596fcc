package brandai.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the GitHub OAuth application and REST API.
 *
 * <p>Configuration prefix: {@code brandai.github}
 *
 * <p>Client credentials are optional at startup. Operations that need them
 * fail with a configuration error when they are missing, so the service can
 * still boot with only one of the two OAuth flows configured.
 */
@ConfigMapping(prefix = "brandai.github")
public interface GitHubConfig {

    /**
     * OAuth App client ID used by the authorization-code flow.
     *
     * @return Client ID
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * OAuth App client secret.
     *
     * <p>Required for the authorization-code exchange and the refresh-token
     * grant. Sent with device token polling when present.
     *
     * @return Client secret
     */
    @WithName("client-secret")
    Optional<String> clientSecret();

    /**
     * Callback URL registered with the OAuth App.
     *
     * @return Redirect URI, omitted from the authorize URL when empty
     */
    @WithName("redirect-uri")
    Optional<String> redirectUri();

    /**
     * Client ID used for the device flow.
     *
     * @return Device flow client ID
     */
    @WithName("device-client-id")
    Optional<String> deviceClientId();

    /**
     * OAuth scopes requested by both flows.
     *
     * @return Scopes (default: repo, read:org, read:user)
     */
    @WithDefault("repo,read:org,read:user")
    List<String> scopes();

    /**
     * Base URL of the identity endpoints.
     *
     * @return OAuth base URL (default: https://github.com)
     */
    @WithName("oauth-base-url")
    @WithDefault("https://github.com")
    String oauthBaseUrl();

    /**
     * Base URL of the REST API.
     *
     * @return API base URL (default: https://api.github.com)
     */
    @WithName("api-base-url")
    @WithDefault("https://api.github.com")
    String apiBaseUrl();

    /**
     * Timeout applied to each identity endpoint call.
     *
     * @return OAuth call timeout (default: 10 seconds)
     */
    @WithName("oauth-timeout")
    @WithDefault("PT10S")
    Duration oauthTimeout();

    /**
     * Timeout applied to each REST API call.
     *
     * @return API call timeout (default: 30 seconds)
     */
    @WithName("api-timeout")
    @WithDefault("PT30S")
    Duration apiTimeout();

    /**
     * User-Agent header sent on every call.
     *
     * @return User agent (default: BrandAI)
     */
    @WithName("user-agent")
    @WithDefault("BrandAI")
    String userAgent();

    /**
     * Device flow polling configuration.
     */
    DeviceFlowConfig device();

    /**
     * Device flow polling options.
     */
    interface DeviceFlowConfig {

        /**
         * Maximum token polling attempts before giving up.
         *
         * @return Max attempts (default: 20)
         */
        @WithName("max-attempts")
        @WithDefault("20")
        int maxAttempts();

        /**
         * Polling interval used when neither the caller nor GitHub supplies one.
         *
         * @return Default interval (default: 5 seconds)
         */
        @WithName("default-interval")
        @WithDefault("PT5S")
        Duration defaultInterval();

        /**
         * Amount added to the polling interval on each {@code slow_down} response.
         *
         * @return Slow-down increment (default: 5 seconds)
         */
        @WithName("slow-down-increment")
        @WithDefault("PT5S")
        Duration slowDownIncrement();
    }
}
