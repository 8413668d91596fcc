package brandai.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Outbound port for short-lived, single-use OAuth states.
 */
public interface OAuthStateRepository {

    /**
     * Record an issued state.
     *
     * @param state the state value
     * @param ttl   how long the state remains valid
     */
    Uni<Void> store(String state, Duration ttl);

    /**
     * Remove a state if it exists and has not expired.
     *
     * @param state the state value
     * @return true if the state was valid and is now consumed
     */
    Uni<Boolean> consume(String state);
}
