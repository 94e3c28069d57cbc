package com.taskwarden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the server pool and completion enforcement.
 */
@Service
public class TaskwardenMetrics {

    private final MeterRegistry registry;

    public TaskwardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Server pool ---

    /**
     * @param source "warm", "cold" or "fallback" (no lease, caller starts the CLI directly)
     */
    public void recordLease(String pool, String source) {
        Counter.builder("taskwarden.pool.leases")
                .description("Lease requests by outcome")
                .tag("pool", pool)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordWorkerStartup(String pool, long ms) {
        Timer.builder("taskwarden.pool.worker.startup")
                .description("Time from spawn until the worker answered its readiness probe")
                .tag("pool", pool)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWorkerExit(String pool, String lastState) {
        Counter.builder("taskwarden.pool.worker.exits")
                .description("Worker processes that exited on their own")
                .tag("pool", pool)
                .tag("state", lastState)
                .register(registry)
                .increment();
    }

    public void recordWarmupFailure(String pool) {
        Counter.builder("taskwarden.pool.warmup.failures")
                .description("Background warmup spawns that failed")
                .tag("pool", pool)
                .register(registry)
                .increment();
    }

    // --- Completion enforcement ---

    /**
     * @param kind "reminder", "partial" or "todo"
     */
    public void recordContinuation(String kind) {
        Counter.builder("taskwarden.completion.continuations")
                .description("Continuation prompts dispatched to the agent")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordOutcome(String state) {
        Counter.builder("taskwarden.completion.outcomes")
                .description("Final completion state per task")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordContinuationDepth(int attempts) {
        DistributionSummary.builder("taskwarden.completion.attempts")
                .description("Continuation attempts used per task")
                .register(registry)
                .record(attempts);
    }
}
