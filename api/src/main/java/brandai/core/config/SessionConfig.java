package brandai.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for BrandAI session tokens.
 *
 * <p>Configuration prefix: {@code brandai.session}
 */
@ConfigMapping(prefix = "brandai.session")
public interface SessionConfig {

    /**
     * Shared HMAC secret used to sign and verify session tokens.
     *
     * @return Signing secret
     */
    Optional<String> secret();

    /**
     * JWS algorithm. One of HS256, HS384 or HS512.
     *
     * @return Algorithm (default: HS256)
     */
    @WithDefault("HS256")
    String algorithm();

    /**
     * Session token lifetime in hours.
     *
     * @return Expiry hours (default: 24)
     */
    @WithName("expiry-hours")
    @WithDefault("24")
    long expiryHours();
}
