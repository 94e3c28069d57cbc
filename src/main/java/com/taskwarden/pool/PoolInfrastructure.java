package com.taskwarden.pool;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators and tuning shared by every pool created from one registry.
 *
 * @param launcher            starts worker processes
 * @param healthProbe         readiness check used during startup
 * @param portAllocator       source of free loopback ports
 * @param clock               time source for startup deadlines and warmup backoff
 * @param listener            lifecycle observer
 * @param pollInterval        pause between readiness probes
 * @param maxWarmupFailures   consecutive warmup failures after which warmups stop; 0 = never stop
 */
public record PoolInfrastructure(
    WorkerLauncher launcher,
    HealthProbe healthProbe,
    PortAllocator portAllocator,
    Clock clock,
    PoolListener listener,
    Duration pollInterval,
    int maxWarmupFailures
) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);

    public PoolInfrastructure {
        if (clock == null) clock = Clock.systemUTC();
        if (listener == null) listener = PoolListener.NONE;
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
        if (maxWarmupFailures < 0) maxWarmupFailures = 0;
    }

    public PoolInfrastructure(WorkerLauncher launcher, HealthProbe healthProbe, PortAllocator portAllocator) {
        this(launcher, healthProbe, portAllocator, Clock.systemUTC(), PoolListener.NONE, DEFAULT_POLL_INTERVAL, 0);
    }

    public PoolInfrastructure withListener(PoolListener listener) {
        return new PoolInfrastructure(launcher, healthProbe, portAllocator, clock, listener, pollInterval,
                maxWarmupFailures);
    }
}
