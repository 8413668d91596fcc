package brandai.adapter.in.rest;

import java.time.Duration;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import brandai.adapter.in.dto.ApiResponse;
import brandai.adapter.in.dto.AuthUrlResponse;
import brandai.adapter.in.dto.DeviceFlowResponse;
import brandai.adapter.in.dto.DeviceFlowVerifyRequest;
import brandai.adapter.in.dto.SessionResponse;
import brandai.adapter.in.dto.UserResponse;
import brandai.adapter.in.dto.UserSummaryResponse;
import brandai.core.exception.UpstreamAuthException;
import brandai.core.port.in.OAuthFlowManagement;
import brandai.core.port.in.SessionAuthentication;

/**
 * REST endpoints for GitHub sign-in and the current session.
 *
 * <p>Two flows are supported:
 * <ul>
 *   <li>Authorization code: {@code /github/login} then {@code /github/callback}</li>
 *   <li>Device: {@code /github/device/initiate} then {@code /github/device/verify}</li>
 * </ul>
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    private final OAuthFlowManagement oauthFlows;
    private final SessionAuthentication sessionAuthentication;

    @Inject
    public AuthResource(OAuthFlowManagement oauthFlows, SessionAuthentication sessionAuthentication) {
        this.oauthFlows = oauthFlows;
        this.sessionAuthentication = sessionAuthentication;
    }

    @GET
    @Path("/github/login")
    public Uni<ApiResponse<AuthUrlResponse>> login(@QueryParam("state") String state) {
        return oauthFlows
                .initiateAuthorizationFlow(Optional.ofNullable(state))
                .map(request -> ApiResponse.ok("GitHub OAuth URL generated", AuthUrlResponse.from(request)));
    }

    /**
     * GitHub redirects here with either {@code code} and {@code state}, or an {@code error}
     * when the user denied access.
     */
    @GET
    @Path("/github/callback")
    public Uni<ApiResponse<SessionResponse>> callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error,
            @QueryParam("error_description") String errorDescription) {
        if (error != null && !error.isBlank()) {
            LOG.infof("GitHub authorization denied: %s", error);
            throw new UpstreamAuthException(
                    "GitHub OAuth error: " + (errorDescription != null ? errorDescription : error));
        }
        return oauthFlows
                .completeAuthorizationFlow(code, state)
                .map(session -> ApiResponse.ok("GitHub authentication successful", SessionResponse.from(session)));
    }

    @POST
    @Path("/github/device/initiate")
    public Uni<ApiResponse<DeviceFlowResponse>> initiateDeviceFlow() {
        return oauthFlows
                .initiateDeviceFlow()
                .map(handle -> ApiResponse.ok("Device flow initiated", DeviceFlowResponse.from(handle)));
    }

    @POST
    @Path("/github/device/verify")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<ApiResponse<SessionResponse>> verifyDeviceFlow(DeviceFlowVerifyRequest request) {
        if (request == null || request.deviceCode() == null || request.deviceCode().isBlank()) {
            throw new IllegalArgumentException("device_code is required");
        }
        if (request.interval() != null && request.interval() < 1) {
            throw new IllegalArgumentException("interval must be at least 1 second");
        }
        final Optional<Duration> interval =
                Optional.ofNullable(request.interval()).map(Duration::ofSeconds);
        return oauthFlows
                .completeDeviceFlow(request.deviceCode(), request.userCode(), interval)
                .map(session -> ApiResponse.ok("Device flow authentication successful", SessionResponse.from(session)));
    }

    @POST
    @Path("/github/token/refresh")
    public Uni<ApiResponse<UserSummaryResponse>> refreshGitHubToken(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final String token = RequestParams.bearerToken(authorization);
        return sessionAuthentication
                .authenticate(token)
                .flatMap(account -> oauthFlows.refreshProviderToken(account.id()))
                .map(account -> ApiResponse.ok("GitHub token refreshed", UserSummaryResponse.from(account)));
    }

    @GET
    @Path("/me")
    public Uni<ApiResponse<UserResponse>> me(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final String token = RequestParams.bearerToken(authorization);
        return sessionAuthentication
                .authenticate(token)
                .map(account -> ApiResponse.ok("User retrieved", UserResponse.from(account)));
    }
}
