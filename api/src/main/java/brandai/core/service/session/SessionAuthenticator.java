package brandai.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import brandai.core.exception.InvalidTokenException;
import brandai.core.model.user.UserAccount;
import brandai.core.port.in.SessionAuthentication;
import brandai.core.service.user.UserAccountService;

/**
 * Resolves session tokens to stored accounts. Fails closed.
 */
@ApplicationScoped
public class SessionAuthenticator implements SessionAuthentication {

    private final SessionTokenIssuer tokenIssuer;
    private final UserAccountService userAccountService;

    @Inject
    public SessionAuthenticator(SessionTokenIssuer tokenIssuer, UserAccountService userAccountService) {
        this.tokenIssuer = tokenIssuer;
        this.userAccountService = userAccountService;
    }

    @Override
    public Uni<UserAccount> authenticate(String sessionToken) {
        return Uni.createFrom()
                .item(() -> tokenIssuer.verify(sessionToken))
                .flatMap(claims -> userAccountService.findById(claims.subject()))
                .map(account -> account.orElseThrow(() -> new InvalidTokenException("User not found")));
    }
}
