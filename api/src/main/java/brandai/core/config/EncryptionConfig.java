package brandai.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for encryption of provider tokens at rest.
 *
 * <p>Configuration prefix: {@code brandai.encryption}
 */
@ConfigMapping(prefix = "brandai.encryption")
public interface EncryptionConfig {

    /**
     * Master secret the AES key is derived from.
     *
     * @return Master secret
     */
    Optional<String> secret();

    /**
     * PBKDF2 iteration count. Values below 100000 are rejected.
     *
     * @return Iterations (default: 100000)
     */
    @WithDefault("100000")
    int iterations();
}
