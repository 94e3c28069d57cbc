package com.taskwarden.dispatch.api;

import com.taskwarden.pool.PoolSnapshot;
import com.taskwarden.pool.ServerPoolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the server pools started in this process.
 */
@RestController
@RequestMapping("/api/v1/pools")
public class PoolController {

    private final ServerPoolRegistry registry;

    public PoolController(ServerPoolRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /api/v1/pools: one snapshot per started pool plus the default platform name.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> pools() {
        List<PoolSnapshot> snapshots = registry.snapshots();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("defaultPlatform", registry.defaultPlatform());
        result.put("pools", snapshots);
        return ResponseEntity.ok(result);
    }
}
