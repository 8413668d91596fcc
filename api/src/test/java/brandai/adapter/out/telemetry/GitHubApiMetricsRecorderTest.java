package brandai.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import brandai.core.model.github.GitHubRequestOutcome;

@DisplayName("GitHubApiMetricsRecorder")
class GitHubApiMetricsRecorderTest {

    private SimpleMeterRegistry registry;
    private GitHubApiMetricsRecorder recorder;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        recorder = new GitHubApiMetricsRecorder(registry);
    }

    @Test
    @DisplayName("should count requests by outcome")
    void shouldCountByOutcome() {
        recorder.recordRequest(GitHubRequestOutcome.SUCCESS, 12);
        recorder.recordRequest(GitHubRequestOutcome.SUCCESS, 8);
        recorder.recordRequest(GitHubRequestOutcome.RATE_LIMITED, 3);

        assertEquals(2.0, registry.get("brandai.github.requests").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.get("brandai.github.requests").tag("outcome", "rate_limited").counter().count());
    }

    @Test
    @DisplayName("should record latency by outcome")
    void shouldRecordLatency() {
        recorder.recordRequest(GitHubRequestOutcome.ERROR, 250);

        var timer = registry.get("brandai.github.request.duration").tag("outcome", "error").timer();
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }
}
