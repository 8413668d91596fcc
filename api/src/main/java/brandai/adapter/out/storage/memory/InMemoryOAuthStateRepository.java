package brandai.adapter.out.storage.memory;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import brandai.core.port.out.OAuthStateRepository;

/**
 * Caffeine-backed store for issued OAuth states.
 *
 * <p>Each state expires after its own TTL and can be consumed once. The cache
 * is bounded so unauthenticated login requests cannot grow it without limit.
 */
@ApplicationScoped
public class InMemoryOAuthStateRepository implements OAuthStateRepository {

    private static final long MAX_STATES = 100_000;

    private final Cache<String, Duration> states;

    @Inject
    public InMemoryOAuthStateRepository() {
        this(Ticker.systemTicker());
    }

    InMemoryOAuthStateRepository(Ticker ticker) {
        this.states = Caffeine.newBuilder()
                .expireAfter(new PerStateExpiry())
                .maximumSize(MAX_STATES)
                .ticker(ticker)
                .build();
    }

    /**
     * Expires each state after the TTL it was stored with.
     */
    private static class PerStateExpiry implements Expiry<String, Duration> {
        @Override
        public long expireAfterCreate(String key, Duration ttl, long currentTime) {
            return ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Duration ttl, long currentTime, long currentDuration) {
            return ttl.toNanos();
        }

        @Override
        public long expireAfterRead(String key, Duration ttl, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Override
    public Uni<Void> store(String state, Duration ttl) {
        return Uni.createFrom().item(() -> {
            states.put(state, ttl);
            return null;
        });
    }

    @Override
    public Uni<Boolean> consume(String state) {
        return Uni.createFrom().item(() -> states.asMap().remove(state) != null);
    }
}
