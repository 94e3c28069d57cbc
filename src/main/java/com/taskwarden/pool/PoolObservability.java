package com.taskwarden.pool;

import com.taskwarden.core.events.EventBus;
import com.taskwarden.core.events.TaskwardenEvent;
import com.taskwarden.core.metrics.TaskwardenMetrics;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Forwards pool lifecycle moments to Micrometer and the {@link EventBus}.
 */
@Component
public class PoolObservability implements PoolListener {

    private final TaskwardenMetrics metrics;
    private final EventBus eventBus;

    public PoolObservability(TaskwardenMetrics metrics, EventBus eventBus) {
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    @Override
    public void leaseAcquired(String poolName, String source) {
        metrics.recordLease(poolName, source);
        eventBus.publish(TaskwardenEvent.of("pool.lease.acquired", null, poolName,
                "Lease acquired (" + source + ")", Map.of("source", source)));
    }

    @Override
    public void workerReady(String poolName, int workerId, String url, long startupMs) {
        metrics.recordWorkerStartup(poolName, startupMs);
        eventBus.publish(TaskwardenEvent.of("pool.worker.ready", null, poolName,
                "Worker #" + workerId + " ready at " + url,
                Map.of("workerId", workerId, "url", url, "startupMs", startupMs)));
    }

    @Override
    public void workerExited(String poolName, int workerId, Integer exitCode, WorkerState lastState) {
        metrics.recordWorkerExit(poolName, lastState.name().toLowerCase(Locale.ROOT));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workerId", workerId);
        payload.put("exitCode", exitCode);
        payload.put("lastState", lastState.name());
        eventBus.publish(TaskwardenEvent.of("pool.worker.exited", null, poolName,
                "Worker #" + workerId + " exited while " + lastState, payload));
    }

    @Override
    public void warmupFailed(String poolName, int failureStreak, long backoffMs, Throwable error) {
        metrics.recordWarmupFailure(poolName);
        eventBus.publish(TaskwardenEvent.of("pool.warmup.failed", null, poolName,
                "Warmup failed: " + error.getMessage(),
                Map.of("failureStreak", failureStreak, "backoffMs", backoffMs)));
    }

    @Override
    public void warmupSuspended(String poolName, int consecutiveFailures) {
        eventBus.publish(TaskwardenEvent.of("pool.warmup.suspended", null, poolName,
                "Warmups suspended after " + consecutiveFailures + " consecutive failures",
                Map.of("consecutiveFailures", consecutiveFailures)));
    }
}
