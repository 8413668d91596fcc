package brandai.core.model.auth;

import brandai.core.model.user.UserSummary;

/**
 * Result of a completed OAuth flow.
 *
 * @param accessToken signed session token
 * @param tokenType   always {@code Bearer}
 * @param expiresIn   session lifetime in seconds
 * @param user        the signed-in user
 */
public record SessionIssued(String accessToken, String tokenType, long expiresIn, UserSummary user) {

    public static final String BEARER = "Bearer";

    public static SessionIssued bearer(String accessToken, long expiresIn, UserSummary user) {
        return new SessionIssued(accessToken, BEARER, expiresIn, user);
    }
}
