package com.taskwarden.pool;

/**
 * Thrown when a spawn is refused because the pool already tracks {@code maxTotal} workers.
 */
public class PoolCapacityException extends PoolException {

    private final int maxTotal;

    public PoolCapacityException(String poolName, int maxTotal) {
        super(poolName + " at capacity (" + maxTotal + ")");
        this.maxTotal = maxTotal;
    }

    public int getMaxTotal() {
        return maxTotal;
    }
}
