package com.taskwarden.pool;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns one {@link ServerPool} per host platform. Pools are created on first lookup;
 * later lookups push the current runtime and options into the existing pool.
 */
public class ServerPoolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerPoolRegistry.class);

    private final PoolRuntime runtime;
    private final ServerPoolProperties properties;
    private final PoolInfrastructure infrastructure;
    private final Map<String, ServerPool> pools = new LinkedHashMap<>();

    public ServerPoolRegistry(PoolRuntime runtime, ServerPoolProperties properties,
                              PoolInfrastructure infrastructure) {
        this.runtime = runtime;
        this.properties = properties;
        this.infrastructure = infrastructure;
    }

    /** Pool for the platform this process runs on (or the configured override). */
    public ServerPool getDefaultPool() {
        return getPool(properties.resolvePlatform());
    }

    public synchronized ServerPool getPool(String platform) {
        PoolOptions options = properties.optionsFor(platform);
        ServerPool existing = pools.get(platform);
        if (existing != null && !existing.isDisposed()) {
            existing.updateConfig(runtime, options);
            return existing;
        }
        log.info("Creating server pool '{}' (minIdle={}, maxTotal={}, enabled={})",
                platform, options.minIdle(), options.maxTotal(), options.enabled());
        ServerPool pool = new ServerPool(platform, runtime, options, infrastructure);
        pools.put(platform, pool);
        return pool;
    }

    public synchronized void disposePool(String platform) {
        ServerPool pool = pools.remove(platform);
        if (pool != null) {
            pool.dispose();
        }
    }

    /** Snapshots of the pools created so far; never creates a pool. */
    public synchronized List<PoolSnapshot> snapshots() {
        List<PoolSnapshot> result = new ArrayList<>();
        for (ServerPool pool : pools.values()) {
            result.add(pool.snapshot());
        }
        return result;
    }

    public String defaultPlatform() {
        return properties.resolvePlatform();
    }

    @PreDestroy
    public synchronized void shutdown() {
        for (var entry : pools.entrySet()) {
            try {
                entry.getValue().dispose();
            } catch (RuntimeException e) {
                log.warn("Error disposing pool '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        pools.clear();
    }
}
