package com.taskwarden.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskwardenMetricsTest {

    private SimpleMeterRegistry registry;
    private TaskwardenMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TaskwardenMetrics(registry);
    }

    @Test
    @DisplayName("recordLease counts by pool and source")
    void recordLease() {
        metrics.recordLease("linux", "warm");
        metrics.recordLease("linux", "warm");
        metrics.recordLease("linux", "cold");

        var warm = registry.find("taskwarden.pool.leases").tag("source", "warm").counter();
        var cold = registry.find("taskwarden.pool.leases").tag("source", "cold").counter();

        assertNotNull(warm);
        assertNotNull(cold);
        assertEquals(2.0, warm.count());
        assertEquals(1.0, cold.count());
    }

    @Test
    @DisplayName("recordWorkerStartup creates a timer")
    void recordWorkerStartup() {
        metrics.recordWorkerStartup("linux", 850);

        var timer = registry.find("taskwarden.pool.worker.startup").tag("pool", "linux").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("worker exits and warmup failures are counted")
    void exitsAndFailures() {
        metrics.recordWorkerExit("linux", "idle");
        metrics.recordWarmupFailure("linux");
        metrics.recordWarmupFailure("linux");

        assertEquals(1.0, registry.find("taskwarden.pool.worker.exits").tag("state", "idle").counter().count());
        assertEquals(2.0, registry.find("taskwarden.pool.warmup.failures").counter().count());
    }

    @Test
    @DisplayName("continuations, outcomes and attempt depth are recorded")
    void completionMetrics() {
        metrics.recordContinuation("reminder");
        metrics.recordContinuation("todo");
        metrics.recordOutcome("DONE");
        metrics.recordContinuationDepth(2);

        assertEquals(1.0, registry.find("taskwarden.completion.continuations")
                .tag("kind", "todo").counter().count());
        assertEquals(1.0, registry.find("taskwarden.completion.outcomes")
                .tag("state", "DONE").counter().count());
        var summary = registry.find("taskwarden.completion.attempts").summary();
        assertNotNull(summary);
        assertEquals(2.0, summary.totalAmount());
    }
}
