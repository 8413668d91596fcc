package brandai.core.port.in;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import brandai.core.model.auth.AuthorizationRequest;
import brandai.core.model.auth.DeviceFlowHandle;
import brandai.core.model.auth.SessionIssued;
import brandai.core.model.user.UserAccount;

/**
 * Inbound port for the GitHub sign-in flows.
 *
 * <p>Both flows end the same way: the GitHub access token is encrypted, the
 * local account is created or updated, and a BrandAI session token is issued.
 * A session is only issued after the account has been stored.
 */
public interface OAuthFlowManagement {

    /**
     * Build the GitHub authorize URL for the authorization-code flow.
     *
     * @param state caller supplied CSRF state; a random one is generated when empty
     * @return the authorize URL and the state it carries
     * @throws brandai.core.exception.ConfigurationException if the client id is not configured
     */
    Uni<AuthorizationRequest> initiateAuthorizationFlow(Optional<String> state);

    /**
     * Exchange an authorization code for a GitHub token and sign the user in.
     *
     * @param code  the authorization code from the callback
     * @param state the state from the callback
     * @return the issued session
     */
    Uni<SessionIssued> completeAuthorizationFlow(String code, String state);

    /**
     * Request a device and user code pair from GitHub.
     *
     * @return the codes to show the user
     */
    Uni<DeviceFlowHandle> initiateDeviceFlow();

    /**
     * Poll GitHub until the user approves the device, then sign the user in.
     *
     * @param deviceCode the device code from {@link #initiateDeviceFlow()}
     * @param userCode   the user code shown to the user
     * @param interval   starting polling interval; the configured default when empty
     * @return the issued session
     */
    Uni<SessionIssued> completeDeviceFlow(String deviceCode, String userCode, Optional<Duration> interval);

    /**
     * Renew the stored GitHub access token using the stored refresh token.
     *
     * @param userId local user id
     * @return the updated account
     */
    Uni<UserAccount> refreshProviderToken(String userId);
}
