package brandai.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import brandai.core.port.out.UserAccountRepository;

/**
 * SPI for user account storage implementations.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>mongodb (priority: 100) - MongoDB {@code users} collection</li>
 *   <li>memory (priority: 0) - In-memory storage (development and tests)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (brandai.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface UserAccountStorageProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "mongodb", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is configured and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the repository implementation.
     *
     * @return User account repository instance
     */
    UserAccountRepository createRepository();

    /**
     * Report the health of the storage backend.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
