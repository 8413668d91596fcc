package brandai.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import brandai.core.port.out.UserAccountRepository;
import brandai.spi.UserAccountStorageProvider;

/**
 * In-memory user account storage provider.
 *
 * <p>Always available. Serves as the fallback when MongoDB is not configured.
 */
@ApplicationScoped
public class InMemoryUserAccountStorageProvider implements UserAccountStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryUserAccountStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private InMemoryUserAccountRepository repository;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized UserAccountRepository createRepository() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("User accounts are stored in memory only and are lost on restart.");
            LOG.warn("Set brandai.storage.mongodb.connection-string for persistent storage.");
        }

        if (repository == null) {
            repository = new InMemoryUserAccountRepository();
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("user-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("accounts", repository != null ? repository.getAccountCount() : 0)
                .build());
    }
}
