package brandai.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Non-blocking wait between device flow polling attempts.
 */
public interface PollingTimer {

    /**
     * Complete after the given duration without blocking the caller's thread.
     */
    Uni<Void> sleep(Duration duration);
}
