package com.hangar.dispatch.api;

import com.hangar.core.health.HealthCheckService;
import com.hangar.core.health.HealthStatus;
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

    @Test
    @DisplayName("All components up returns 200 UP")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("docker", HealthStatus.Status.UP, "Docker daemon reachable", Map.of()),
                new HealthStatus("storage", HealthStatus.Status.UP, "writable", Map.of("projects", "2"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.docker.status").value("UP"))
                .andExpect(jsonPath("$.components.docker.metadata").doesNotExist())
                .andExpect(jsonPath("$.components.storage.metadata.projects").value("2"));
    }

    @Test
    @DisplayName("A degraded component keeps 200")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("docker", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("catalog", HealthStatus.Status.DEGRADED, "1 project in error", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("A down component returns 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("docker", HealthStatus.Status.DOWN, "Cannot reach daemon", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.docker.detail").value("Cannot reach daemon"));
    }
}
