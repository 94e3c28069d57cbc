package com.taskwarden.dispatch.api;

import com.taskwarden.core.health.HealthCheckService;
import com.taskwarden.core.health.HealthStatus;
import com.taskwarden.pool.ServerPoolRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @MockitoBean(enforceOverride = false)
    private ServerPoolRegistry serverPoolRegistry;

    @Test
    @DisplayName("GET /health returns 200 UP when everything is up")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agent-cli", HealthStatus.Status.UP, "Found /usr/bin/opencode",
                        Map.of("command", "opencode")),
                new HealthStatus("pool", HealthStatus.Status.UP, "No pool started yet", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components['agent-cli'].metadata.command").value("opencode"))
                .andExpect(jsonPath("$.components.pool.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /health returns 200 DEGRADED while warmups fail")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agent-cli", HealthStatus.Status.UP, "Found", Map.of()),
                new HealthStatus("pool:linux", HealthStatus.Status.DEGRADED, "Warmup failing (streak 1)",
                        Map.of("backoffRemainingMs", "900"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components['pool:linux'].status").value("DEGRADED"));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agent-cli", HealthStatus.Status.DOWN, "'opencode' not found on PATH", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }
}
