package brandai.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import brandai.core.service.user.UserAccountStorageProviderRegistry;
import brandai.spi.UserAccountStorageProvider;

/**
 * Readiness check delegating to the selected user storage provider.
 */
@Readiness
@ApplicationScoped
public class UserStorageHealthCheck implements HealthCheck {

    private final UserAccountStorageProviderRegistry registry;

    @Inject
    public UserStorageHealthCheck(UserAccountStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final UserAccountStorageProvider provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.builder()
                        .name("user-storage-" + provider.name())
                        .up()
                        .build());
    }
}
