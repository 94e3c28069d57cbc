package com.taskwarden.core.health;

import com.taskwarden.agent.AgentProperties;
import com.taskwarden.pool.PoolSnapshot;
import com.taskwarden.pool.ServerPoolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AgentProperties agentProperties;
    private final ServerPoolRegistry poolRegistry;

    public HealthCheckService(
            AgentProperties agentProperties,
            @Autowired(required = false) ServerPoolRegistry poolRegistry) {
        this.agentProperties = agentProperties;
        this.poolRegistry = poolRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkAgentCli());
        results.addAll(checkPools());
        return results;
    }

    private HealthStatus checkAgentCli() {
        String command = agentProperties.getCommand();
        Optional<Path> resolved = resolveExecutable(command, System.getenv("PATH"));
        if (resolved.isPresent()) {
            return new HealthStatus("agent-cli", HealthStatus.Status.UP,
                    "Found " + resolved.get(), Map.of("command", command));
        }
        log.warn("Agent CLI '{}' not found on PATH", command);
        return new HealthStatus("agent-cli", HealthStatus.Status.DOWN,
                "'" + command + "' not found on PATH", Map.of("command", command));
    }

    private List<HealthStatus> checkPools() {
        if (poolRegistry == null) {
            return List.of(new HealthStatus("pool", HealthStatus.Status.DOWN,
                    "No server pool registry configured", Map.of()));
        }
        List<PoolSnapshot> snapshots = poolRegistry.snapshots();
        if (snapshots.isEmpty()) {
            return List.of(new HealthStatus("pool", HealthStatus.Status.UP,
                    "No pool started yet (platform " + poolRegistry.defaultPlatform() + ")", Map.of()));
        }
        var results = new ArrayList<HealthStatus>();
        for (PoolSnapshot snapshot : snapshots) {
            results.add(checkPool(snapshot));
        }
        return results;
    }

    static HealthStatus checkPool(PoolSnapshot snapshot) {
        String component = "pool:" + snapshot.name();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("idle", String.valueOf(snapshot.idle()));
        metadata.put("inUse", String.valueOf(snapshot.inUse()));
        metadata.put("total", String.valueOf(snapshot.total()));
        metadata.put("maxTotal", String.valueOf(snapshot.maxTotal()));

        if (snapshot.disposed()) {
            return new HealthStatus(component, HealthStatus.Status.DOWN, "Pool disposed", metadata);
        }
        if (!snapshot.enabled()) {
            return new HealthStatus(component, HealthStatus.Status.UP, "Pool disabled, tasks start the CLI directly",
                    metadata);
        }
        if (snapshot.warmupSuspended()) {
            return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                    "Warmups suspended after repeated failures", metadata);
        }
        if (snapshot.warmupFailureStreak() > 0) {
            metadata.put("backoffRemainingMs", String.valueOf(snapshot.backoffRemainingMs()));
            return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                    "Warmup failing (streak " + snapshot.warmupFailureStreak() + ")", metadata);
        }
        return new HealthStatus(component, HealthStatus.Status.UP,
                snapshot.idle() + " idle, " + snapshot.inUse() + " in use", metadata);
    }

    /**
     * Resolves {@code command} the way a shell would: paths are checked directly, bare names
     * against each {@code PATH} entry.
     */
    static Optional<Path> resolveExecutable(String command, String pathEnv) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        if (command.contains(File.separator) || command.contains("/")) {
            Path path = Path.of(command);
            return Files.isExecutable(path) ? Optional.of(path.toAbsolutePath()) : Optional.empty();
        }
        if (pathEnv == null || pathEnv.isBlank()) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String candidate : List.of(command, command + ".exe", command + ".cmd")) {
                Path path = Path.of(dir, candidate);
                if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                    return Optional.of(path);
                }
            }
        }
        return Optional.empty();
    }
}
