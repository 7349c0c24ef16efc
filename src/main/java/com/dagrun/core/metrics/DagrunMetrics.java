package com.dagrun.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for DAG runs.
 */
public class DagrunMetrics {

    private final MeterRegistry registry;

    public DagrunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Metrics kept in a private in-memory registry, for use without a configured one. */
    public static DagrunMetrics standalone() {
        return new DagrunMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordTaskExecution(String taskType, String status, Duration elapsed) {
        Timer.builder("dagrun.task.duration")
                .tag("type", taskType)
                .tag("status", status)
                .register(registry)
                .record(elapsed);
    }

    public void recordTaskOutcome(String status) {
        Counter.builder("dagrun.task.outcomes")
                .description("Terminal task statuses")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCleanup(boolean success) {
        Counter.builder("dagrun.cleanup.total")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordRun(boolean allOk, Duration elapsed) {
        Timer.builder("dagrun.run.duration")
                .tag("result", allOk ? "ok" : "failed")
                .register(registry)
                .record(elapsed);
    }
}
