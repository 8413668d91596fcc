package brandai.adapter.out.storage.mongodb;

import java.util.Optional;
import java.util.function.Function;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import brandai.core.config.StorageConfig;
import brandai.core.port.out.UserAccountRepository;
import brandai.spi.UserAccountStorageProvider;

/**
 * MongoDB user account storage provider.
 *
 * <p>Available when {@code brandai.storage.mongodb.connection-string} is set.
 * The client is created on first use and closed on shutdown.
 */
@ApplicationScoped
public class MongoUserAccountStorageProvider implements UserAccountStorageProvider {

    private static final Logger LOG = Logger.getLogger(MongoUserAccountStorageProvider.class);
    private static final int PRIORITY = 100;
    static final String COLLECTION = "users";

    private final StorageConfig config;
    private final Function<String, MongoClient> clientFactory;

    private MongoClient client;
    private MongoUserAccountRepository repository;

    @Inject
    public MongoUserAccountStorageProvider(StorageConfig config) {
        this(config, MongoClients::create);
    }

    MongoUserAccountStorageProvider(StorageConfig config, Function<String, MongoClient> clientFactory) {
        this.config = config;
        this.clientFactory = clientFactory;
    }

    @Override
    public String name() {
        return "mongodb";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return config.mongodb().connectionString().filter(s -> !s.isBlank()).isPresent();
    }

    @Override
    public synchronized UserAccountRepository createRepository() {
        if (repository == null) {
            final String connectionString = config.mongodb()
                    .connectionString()
                    .orElseThrow(() -> new IllegalStateException("MongoDB connection string is not configured"));
            final MongoClient created = clientFactory.apply(connectionString);
            final MongoUserAccountRepository initialized;
            try {
                initialized = new MongoUserAccountRepository(
                        created.getDatabase(config.mongodb().database()).getCollection(COLLECTION));
                initialized.ensureIndexes();
            } catch (RuntimeException e) {
                created.close();
                throw e;
            }
            client = created;
            repository = initialized;
            LOG.infof("MongoDB user storage initialized (database: %s)", config.mongodb().database());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var builder =
                HealthCheckResponse.named("user-storage-mongodb").withData("database", config.mongodb().database());
        if (client == null) {
            return Optional.of(builder.down().withData("error", "Client not initialized").build());
        }
        try {
            client.getDatabase(config.mongodb().database()).runCommand(new Document("ping", 1));
            return Optional.of(builder.up().build());
        } catch (MongoException e) {
            return Optional.of(builder.down().withData("error", e.getMessage()).build());
        }
    }

    @PreDestroy
    synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
