package com.dagrun.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DagrunMetricsTest {

    private SimpleMeterRegistry registry;
    private DagrunMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DagrunMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskExecution records by type and status tags")
    void recordTaskExecution() {
        metrics.recordTaskExecution("Extract", "SUCCEEDED", Duration.ofMillis(200));
        metrics.recordTaskExecution("Extract", "FAILED", Duration.ofMillis(50));
        metrics.recordTaskExecution("Extract", "SUCCEEDED", Duration.ofMillis(100));

        var succeeded = registry.find("dagrun.task.duration")
                .tag("type", "Extract").tag("status", "SUCCEEDED").timer();
        assertNotNull(succeeded);
        assertEquals(2, succeeded.count());
        assertEquals(300.0, succeeded.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    @DisplayName("recordTaskOutcome increments per-status counters")
    void recordTaskOutcome() {
        metrics.recordTaskOutcome("SUCCEEDED");
        metrics.recordTaskOutcome("SUCCEEDED");
        metrics.recordTaskOutcome("SKIPPED_DEPENDENCY_FAILURE");

        assertEquals(2.0, registry.find("dagrun.task.outcomes").tag("status", "SUCCEEDED").counter().count());
        assertEquals(1.0, registry.find("dagrun.task.outcomes")
                .tag("status", "SKIPPED_DEPENDENCY_FAILURE").counter().count());
    }

    @Test
    @DisplayName("recordCleanup splits successes and failures")
    void recordCleanup() {
        metrics.recordCleanup(true);
        metrics.recordCleanup(false);
        metrics.recordCleanup(true);

        assertEquals(2.0, registry.find("dagrun.cleanup.total").tag("success", "true").counter().count());
        assertEquals(1.0, registry.find("dagrun.cleanup.total").tag("success", "false").counter().count());
    }

    @Test
    @DisplayName("recordRun tags the overall result")
    void recordRun() {
        metrics.recordRun(true, Duration.ofSeconds(1));
        metrics.recordRun(false, Duration.ofSeconds(2));

        assertEquals(1, registry.find("dagrun.run.duration").tag("result", "ok").timer().count());
        assertEquals(1, registry.find("dagrun.run.duration").tag("result", "failed").timer().count());
    }

    @Test
    @DisplayName("standalone metrics use their own registry")
    void standalone() {
        var standalone = DagrunMetrics.standalone();
        standalone.recordCleanup(true);
        assertNotSame(registry, standalone.registry());
        assertNotNull(standalone.registry().find("dagrun.cleanup.total").counter());
    }
}
