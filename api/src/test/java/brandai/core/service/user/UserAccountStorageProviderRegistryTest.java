package brandai.core.service.user;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import brandai.core.config.StorageConfig;
import brandai.core.port.out.UserAccountRepository;
import brandai.spi.UserAccountStorageProvider;

@DisplayName("UserAccountStorageProviderRegistry")
class UserAccountStorageProviderRegistryTest {

    private StorageConfig config;
    private UserAccountStorageProvider memory;
    private UserAccountStorageProvider mongodb;

    @BeforeEach
    void setUp() {
        config = mock(StorageConfig.class);
        memory = provider("memory", 0, true);
        mongodb = provider("mongodb", 100, true);
    }

    private static UserAccountStorageProvider provider(String name, int priority, boolean available) {
        var provider = mock(UserAccountStorageProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.priority()).thenReturn(priority);
        when(provider.isAvailable()).thenReturn(available);
        when(provider.createRepository()).thenReturn(mock(UserAccountRepository.class));
        return provider;
    }

    @Test
    @DisplayName("should use the configured provider when available")
    void shouldUseConfiguredProvider() {
        when(config.provider()).thenReturn("memory");
        var registry = new UserAccountStorageProviderRegistry(List.of(memory, mongodb), config);

        assertSame(memory, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should fall back to the highest priority available provider")
    void shouldFallBackByPriority() {
        when(config.provider()).thenReturn("cassandra");
        var registry = new UserAccountStorageProviderRegistry(List.of(memory, mongodb), config);

        assertSame(mongodb, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should skip unavailable providers")
    void shouldSkipUnavailable() {
        when(config.provider()).thenReturn("mongodb");
        var unconfiguredMongo = provider("mongodb", 100, false);
        var registry = new UserAccountStorageProviderRegistry(List.of(memory, unconfiguredMongo), config);

        assertSame(memory, registry.getSelectedProvider());
        assertEquals(List.of(memory), registry.getAvailableProviders());
    }

    @Test
    @DisplayName("should create the repository once")
    void shouldCreateRepositoryOnce() {
        when(config.provider()).thenReturn("memory");
        var registry = new UserAccountStorageProviderRegistry(List.of(memory), config);

        assertSame(registry.getRepository(), registry.getRepository());
        verify(memory, times(1)).createRepository();
    }

    @Test
    @DisplayName("should fail when no provider is available")
    void shouldFailWithoutProviders() {
        when(config.provider()).thenReturn("memory");
        var registry = new UserAccountStorageProviderRegistry(List.of(), config);

        assertThrows(IllegalStateException.class, registry::getRepository);
    }
}
