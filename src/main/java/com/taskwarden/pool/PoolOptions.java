package com.taskwarden.pool;

/**
 * Resolved sizing and startup policy for one {@link ServerPool}.
 *
 * @param minIdle            number of ready workers to keep in reserve
 * @param maxTotal           hard cap on tracked worker processes, never below {@code minIdle}
 * @param coldStartFallback  when true, a failed foreground spawn yields a {@code null} lease
 *                           instead of an exception
 * @param startupTimeoutMs   how long a spawned worker may take to answer its readiness probe
 * @param enabled            when false, {@link ServerPool#acquire()} always returns {@code null}
 */
public record PoolOptions(
    int minIdle,
    int maxTotal,
    boolean coldStartFallback,
    long startupTimeoutMs,
    boolean enabled
) {

    public static final int DEFAULT_MIN_IDLE = 1;
    public static final int DEFAULT_MAX_TOTAL = 2;
    public static final boolean DEFAULT_COLD_START_FALLBACK = true;
    public static final long DEFAULT_STARTUP_TIMEOUT_MS = 60_000L;
    public static final boolean DEFAULT_ENABLED = true;

    public PoolOptions {
        if (minIdle <= 0) minIdle = DEFAULT_MIN_IDLE;
        if (maxTotal <= 0) maxTotal = DEFAULT_MAX_TOTAL;
        if (startupTimeoutMs <= 0) startupTimeoutMs = DEFAULT_STARTUP_TIMEOUT_MS;
        maxTotal = Math.max(maxTotal, minIdle);
    }

    public static PoolOptions defaults() {
        return new PoolOptions(DEFAULT_MIN_IDLE, DEFAULT_MAX_TOTAL,
                DEFAULT_COLD_START_FALLBACK, DEFAULT_STARTUP_TIMEOUT_MS, DEFAULT_ENABLED);
    }

    /**
     * Builds options from partially specified settings; {@code null} or non-positive
     * values fall back to the defaults.
     */
    public static PoolOptions resolve(Integer minIdle, Integer maxTotal, Boolean coldStartFallback,
                                      Long startupTimeoutMs, Boolean enabled) {
        return new PoolOptions(
                minIdle != null ? minIdle : DEFAULT_MIN_IDLE,
                maxTotal != null ? maxTotal : DEFAULT_MAX_TOTAL,
                coldStartFallback != null ? coldStartFallback : DEFAULT_COLD_START_FALLBACK,
                startupTimeoutMs != null ? startupTimeoutMs : DEFAULT_STARTUP_TIMEOUT_MS,
                enabled != null ? enabled : DEFAULT_ENABLED
        );
    }
}
