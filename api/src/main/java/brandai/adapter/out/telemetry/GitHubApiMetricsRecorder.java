package brandai.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import brandai.core.model.github.GitHubRequestOutcome;
import brandai.core.port.out.GitHubApiMetrics;

/**
 * Micrometer metrics for GitHub REST API calls.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code brandai.github.requests} - Calls by outcome</li>
 *   <li>{@code brandai.github.request.duration} - Call latency by outcome</li>
 * </ul>
 */
@ApplicationScoped
public class GitHubApiMetricsRecorder implements GitHubApiMetrics {

    private final MeterRegistry registry;

    @Inject
    public GitHubApiMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRequest(GitHubRequestOutcome outcome, long durationMs) {
        final String tag = outcome.name().toLowerCase(Locale.ROOT);

        Counter.builder("brandai.github.requests")
                .description("GitHub REST API calls")
                .tag("outcome", tag)
                .register(registry)
                .increment();

        Timer.builder("brandai.github.request.duration")
                .description("GitHub REST API call latency")
                .tag("outcome", tag)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
