package com.taskwarden.pool;

/**
 * Where a leased worker came from.
 */
public enum LeaseSource {
    /** Taken from the idle queue. */
    WARM,
    /** Spawned on demand by {@link ServerPool#acquire()}. */
    COLD;

    public String label() {
        return name().toLowerCase();
    }
}
