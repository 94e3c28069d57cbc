package com.taskwarden.pool;

/**
 * Point-in-time view of a pool's bookkeeping, taken under the pool lock.
 *
 * @param name                 pool label (the host platform it serves)
 * @param idle                 ready workers waiting in the idle queue
 * @param inUse                workers currently leased out
 * @param starting             workers registered but not yet ready
 * @param total                all registered workers
 * @param warming              background warmups in flight
 * @param reserved             spawns that passed the capacity check but are not registered yet
 * @param maxTotal             configured cap
 * @param minIdle              configured reserve
 * @param warmupFailureStreak  capped consecutive warmup failures driving the backoff
 * @param backoffRemainingMs   time until the next warmup may start, 0 if none pending
 * @param warmupSuspended      true when warmups stopped after too many consecutive failures
 * @param enabled              configured enabled flag
 * @param disposed             true once {@link ServerPool#dispose()} ran
 */
public record PoolSnapshot(
    String name,
    int idle,
    int inUse,
    int starting,
    int total,
    int warming,
    int reserved,
    int maxTotal,
    int minIdle,
    int warmupFailureStreak,
    long backoffRemainingMs,
    boolean warmupSuspended,
    boolean enabled,
    boolean disposed
) {}
