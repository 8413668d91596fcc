package brandai.core.port.in;

import io.smallrye.mutiny.Uni;

import brandai.core.model.user.UserAccount;

/**
 * Inbound port resolving a BrandAI session token to its account.
 */
public interface SessionAuthentication {

    /**
     * Verify the session token and load the account it names.
     *
     * @param sessionToken the bearer token, without the {@code Bearer} prefix
     * @return the account
     * @throws brandai.core.exception.InvalidTokenException if the token is missing, invalid,
     *         or names an unknown user
     * @throws brandai.core.exception.ExpiredTokenException if the token has expired
     */
    Uni<UserAccount> authenticate(String sessionToken);
}
