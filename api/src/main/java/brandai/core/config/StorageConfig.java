package brandai.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for user account storage.
 *
 * <p>Configuration prefix: {@code brandai.storage}
 */
@ConfigMapping(prefix = "brandai.storage")
public interface StorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: memory, mongodb.
     *
     * @return Provider name (default: memory)
     */
    @WithDefault("memory")
    String provider();

    /**
     * MongoDB-specific configuration.
     */
    MongoConfig mongodb();

    /**
     * MongoDB storage configuration.
     */
    interface MongoConfig {

        /**
         * MongoDB connection string. The provider is unavailable when unset.
         *
         * @return Connection string
         */
        @WithName("connection-string")
        Optional<String> connectionString();

        /**
         * Database holding the {@code users} collection.
         *
         * @return Database name (default: brandai)
         */
        @WithDefault("brandai")
        String database();
    }
}
