package brandai.core.service.user;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import brandai.core.config.StorageConfig;
import brandai.core.port.out.UserAccountRepository;
import brandai.spi.UserAccountStorageProvider;

/**
 * Registry for user account storage providers.
 *
 * <p>Discovers providers via CDI and selects one based on configuration and
 * availability. Selection happens once, at startup.
 */
@ApplicationScoped
public class UserAccountStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(UserAccountStorageProviderRegistry.class);

    private final Iterable<UserAccountStorageProvider> providers;
    private final StorageConfig config;

    private UserAccountStorageProvider selectedProvider;
    private UserAccountRepository repository;

    @Inject
    public UserAccountStorageProviderRegistry(Instance<UserAccountStorageProvider> providers, StorageConfig config) {
        this((Iterable<UserAccountStorageProvider>) providers, config);
    }

    UserAccountStorageProviderRegistry(Iterable<UserAccountStorageProvider> providers, StorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider and open its repository at startup, on a worker thread,
     * so the first request never blocks the event loop on connection setup.
     */
    void onStart(@Observes StartupEvent event) {
        getRepository();
        LOG.infof("User account storage provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the repository of the selected provider.
     *
     * @return User account repository
     */
    public synchronized UserAccountRepository getRepository() {
        if (repository == null) {
            repository = getSelectedProvider().createRepository();
        }
        return repository;
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public synchronized UserAccountStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private UserAccountStorageProvider selectProvider() {
        String configuredProvider = config.provider();
        List<UserAccountStorageProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(UserAccountStorageProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available user account storage providers: %s",
                availableProviders.stream().map(UserAccountStorageProvider::name).toList());

        Optional<UserAccountStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured user account storage provider: %s", configuredProvider);
            return configured.get();
        }

        LOG.warnf("Configured user account storage provider '%s' is not available, falling back", configuredProvider);

        if (!availableProviders.isEmpty()) {
            UserAccountStorageProvider provider = availableProviders.get(0);
            LOG.infof(
                    "Using user account storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No user account storage providers available");
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return List of available providers
     */
    public List<UserAccountStorageProvider> getAvailableProviders() {
        final var available = new ArrayList<UserAccountStorageProvider>();
        for (UserAccountStorageProvider provider : providers) {
            if (provider.isAvailable()) {
                available.add(provider);
            }
        }
        return available;
    }
}
