package brandai.core.service.session;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import brandai.core.config.SessionConfig;
import brandai.core.exception.ConfigurationException;
import brandai.core.exception.ExpiredTokenException;
import brandai.core.exception.InvalidTokenException;
import brandai.core.model.auth.SessionClaims;

/**
 * Issues and verifies BrandAI session tokens.
 *
 * <p>Tokens are compact JWS with HMAC signatures carrying {@code sub} (local
 * user id), {@code iat} and {@code exp}. Verification accepts only the
 * configured algorithm and allows no clock skew.
 */
@ApplicationScoped
public class SessionTokenIssuer {

    private static final Logger LOG = Logger.getLogger(SessionTokenIssuer.class);

    private static final Set<String> SUPPORTED_ALGORITHMS = Set.of(
            AlgorithmIdentifiers.HMAC_SHA256, AlgorithmIdentifiers.HMAC_SHA384, AlgorithmIdentifiers.HMAC_SHA512);

    private final Optional<HmacKey> signingKey;
    private final String algorithm;
    private final Duration lifetime;
    private final Clock clock;

    @Inject
    public SessionTokenIssuer(SessionConfig config, Clock clock) {
        this(config.secret(), config.algorithm(), config.expiryHours(), clock);
    }

    /**
     * Constructor for manual instantiation.
     *
     * @param secret      optional HMAC secret
     * @param algorithm   HS256, HS384 or HS512
     * @param expiryHours token lifetime in hours
     * @param clock       time source
     */
    public SessionTokenIssuer(Optional<String> secret, String algorithm, long expiryHours, Clock clock) {
        if (!SUPPORTED_ALGORITHMS.contains(algorithm)) {
            throw new IllegalArgumentException("Unsupported session token algorithm: " + algorithm);
        }
        if (expiryHours <= 0) {
            throw new IllegalArgumentException("Session expiry must be at least one hour. Got: " + expiryHours);
        }
        this.signingKey = secret.filter(s -> !s.isBlank()).map(s -> new HmacKey(s.getBytes(StandardCharsets.UTF_8)));
        this.algorithm = algorithm;
        this.lifetime = Duration.ofHours(expiryHours);
        this.clock = clock;

        if (signingKey.isEmpty()) {
            LOG.warn("Session signing secret is NOT configured. Set brandai.session.secret (JWT_SECRET_KEY).");
        }
    }

    /**
     * Issue a session token for a local user.
     *
     * @param subjectId local user id
     * @return compact JWS
     * @throws ConfigurationException if no signing secret is configured
     */
    public String issue(String subjectId) {
        final HmacKey key = signingKey.orElseThrow(
                () -> new ConfigurationException("Session signing secret is not configured"));
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Session subject cannot be null or blank");
        }

        final Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final Instant expiresAt = issuedAt.plus(lifetime);

        final JwtClaims claims = new JwtClaims();
        claims.setSubject(subjectId);
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));

        final JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(algorithm);
        jws.setHeader("typ", "JWT");
        jws.setDoKeyValidation(false);

        try {
            final String token = jws.getCompactSerialization();
            LOG.debugf("Issued session token for user %s, expires at %s", subjectId, expiresAt);
            return token;
        } catch (JoseException e) {
            throw new ConfigurationException("Failed to sign session token", e);
        }
    }

    /**
     * Verify a session token and return its claims.
     *
     * @param token compact JWS
     * @return the verified claims
     * @throws ExpiredTokenException if the token has expired
     * @throws InvalidTokenException for any other signature, structure or algorithm failure
     * @throws ConfigurationException if no signing secret is configured
     */
    public SessionClaims verify(String token) {
        final HmacKey key = signingKey.orElseThrow(
                () -> new ConfigurationException("Session signing secret is not configured"));
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Session token is missing");
        }

        final JwtConsumer consumer = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireIssuedAt()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds(0)
                .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
                .setSkipDefaultAudienceValidation()
                .setVerificationKey(key)
                .setRelaxVerificationKeyValidation()
                .setJwsAlgorithmConstraints(
                        new AlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, algorithm))
                .build();

        try {
            final JwtClaims claims = consumer.processToClaims(token);
            return new SessionClaims(
                    claims.getSubject(),
                    Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue()));
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                throw new ExpiredTokenException("Session token has expired");
            }
            LOG.debugf("Session token rejected: %s", e.getMessage());
            throw new InvalidTokenException("Invalid session token", e);
        } catch (MalformedClaimException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid session token claims", e);
        }
    }

    /**
     * Session lifetime in seconds, as reported to clients.
     */
    public long expiresInSeconds() {
        return lifetime.toSeconds();
    }

    public boolean isConfigured() {
        return signingKey.isPresent();
    }
}
