package brandai.adapter.out.threading;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import brandai.core.port.out.PollingTimer;

/**
 * Polling waits scheduled on the Mutiny default executor. No thread is held while waiting.
 */
@ApplicationScoped
public class MutinyPollingTimer implements PollingTimer {

    @Override
    public Uni<Void> sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().voidItem().onItem().delayIt().by(duration);
    }
}
