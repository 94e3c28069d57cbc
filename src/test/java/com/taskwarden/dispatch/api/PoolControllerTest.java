package com.taskwarden.dispatch.api;

import com.taskwarden.core.health.HealthCheckService;
import com.taskwarden.pool.PoolSnapshot;
import com.taskwarden.pool.ServerPoolRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PoolController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PoolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ServerPoolRegistry serverPoolRegistry;

    @MockitoBean(enforceOverride = false)
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /pools lists started pools")
    void listPools() throws Exception {
        when(serverPoolRegistry.defaultPlatform()).thenReturn("linux");
        when(serverPoolRegistry.snapshots()).thenReturn(List.of(
                new PoolSnapshot("linux", 1, 1, 0, 2, 0, 0, 4, 1, 0, 0, false, true, false)));

        mockMvc.perform(get("/api/v1/pools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultPlatform").value("linux"))
                .andExpect(jsonPath("$.pools", hasSize(1)))
                .andExpect(jsonPath("$.pools[0].name").value("linux"))
                .andExpect(jsonPath("$.pools[0].inUse").value(1))
                .andExpect(jsonPath("$.pools[0].warmupSuspended").value(false));
    }

    @Test
    @DisplayName("GET /pools before any pool started is empty")
    void noPools() throws Exception {
        when(serverPoolRegistry.defaultPlatform()).thenReturn("darwin");
        when(serverPoolRegistry.snapshots()).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/pools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pools", hasSize(0)));
    }
}
