package brandai.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import brandai.core.config.GitHubConfig;
import brandai.core.service.auth.TokenCipher;
import brandai.core.service.session.SessionTokenIssuer;

/**
 * Readiness check for the GitHub sign-in configuration.
 *
 * <p>Reports which credentials are configured. The service is DOWN when the
 * session signing secret or the token encryption secret is missing, since no
 * sign-in can complete without them. Missing OAuth client ids only disable the
 * corresponding flow and are reported as data.
 */
@Readiness
@ApplicationScoped
public class GitHubOAuthHealthCheck implements HealthCheck {

    static final String NAME = "github-oauth";

    private final GitHubConfig gitHubConfig;
    private final TokenCipher tokenCipher;
    private final SessionTokenIssuer sessionTokenIssuer;

    @Inject
    public GitHubOAuthHealthCheck(
            GitHubConfig gitHubConfig, TokenCipher tokenCipher, SessionTokenIssuer sessionTokenIssuer) {
        this.gitHubConfig = gitHubConfig;
        this.tokenCipher = tokenCipher;
        this.sessionTokenIssuer = sessionTokenIssuer;
    }

    @Override
    public HealthCheckResponse call() {
        final boolean authCodeFlow = gitHubConfig.clientId().isPresent()
                && gitHubConfig.clientSecret().isPresent();
        final boolean deviceFlow = gitHubConfig.deviceClientId().isPresent();

        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name(NAME);
        builder.withData("authorization_code_flow.configured", authCodeFlow);
        builder.withData("device_flow.configured", deviceFlow);
        builder.withData("session_secret.configured", sessionTokenIssuer.isConfigured());
        builder.withData("encryption_secret.configured", tokenCipher.isConfigured());

        return builder.status(sessionTokenIssuer.isConfigured() && tokenCipher.isConfigured())
                .build();
    }
}
