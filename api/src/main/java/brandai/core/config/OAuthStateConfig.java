package brandai.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for CSRF state enforcement on the authorization-code flow.
 *
 * <p>Configuration prefix: {@code brandai.oauth.state}
 *
 * <p>When enforcement is off, the state is generated and returned to the
 * caller but never checked on the callback.
 */
@ConfigMapping(prefix = "brandai.oauth.state")
public interface OAuthStateConfig {

    /**
     * Require every callback to present a state issued by this service.
     *
     * @return true to enforce single-use states (default: false)
     */
    @WithDefault("false")
    boolean enforce();

    /**
     * How long an issued state stays valid.
     *
     * @return State TTL (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration ttl();
}
