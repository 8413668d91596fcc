package brandai.core.model.github;

import java.util.Optional;

/**
 * Body of a GitHub token endpoint response.
 *
 * <p>GitHub answers token requests with HTTP 200 in both cases: either an
 * access token is present, or an {@code error} code describes why not. Device
 * polling relies on the error codes ({@code authorization_pending},
 * {@code slow_down}, {@code expired_token}) to drive its state machine.
 *
 * @param accessToken      access token, absent on error
 * @param tokenType        token type, usually {@code bearer}
 * @param scope            granted scopes
 * @param refreshToken     refresh token, present only for expiring tokens
 * @param expiresIn        access token lifetime in seconds, when it expires
 * @param error            error code, absent on success
 * @param errorDescription human readable error detail
 */
public record GitHubTokenResponse(
        Optional<String> accessToken,
        String tokenType,
        String scope,
        Optional<String> refreshToken,
        Optional<Long> expiresIn,
        Optional<String> error,
        String errorDescription) {

    public GitHubTokenResponse {
        accessToken = accessToken == null ? Optional.empty() : accessToken.filter(s -> !s.isBlank());
        refreshToken = refreshToken == null ? Optional.empty() : refreshToken.filter(s -> !s.isBlank());
        expiresIn = expiresIn == null ? Optional.empty() : expiresIn;
        error = error == null ? Optional.empty() : error.filter(s -> !s.isBlank());
    }

    public static GitHubTokenResponse success(String accessToken) {
        return new GitHubTokenResponse(
                Optional.of(accessToken), "bearer", null, Optional.empty(), Optional.empty(), Optional.empty(), null);
    }

    public static GitHubTokenResponse error(String error, String description) {
        return new GitHubTokenResponse(
                Optional.empty(), null, null, Optional.empty(), Optional.empty(), Optional.of(error), description);
    }

    public boolean isError() {
        return error.isPresent();
    }

    /**
     * Human readable reason, falling back to the error code.
     */
    public String errorMessage() {
        if (errorDescription != null && !errorDescription.isBlank()) {
            return errorDescription;
        }
        return error.orElse("No access token in response");
    }
}
