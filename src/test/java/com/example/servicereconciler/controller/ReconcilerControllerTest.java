package com.example.servicereconciler.controller;

import com.example.servicereconciler.TestSpecs;
import com.example.servicereconciler.audit.AuditLog;
import com.example.servicereconciler.domain.ActionRecord;
import com.example.servicereconciler.domain.AuditEventKind;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.ServiceRuntimeState.ServiceStateView;
import com.example.servicereconciler.reconciler.Reconciler;
import com.example.servicereconciler.reconciler.TickReport;
import com.example.servicereconciler.registry.ConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ReconcilerControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final Reconciler reconciler = mock(Reconciler.class);
    private final AuditLog auditLog = mock(AuditLog.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ReconcilerController(reconciler, auditLog)).build();
    }

    private static ServiceStateView view(String id, HealthStatus status) {
        return new ServiceStateView(id, status, 0, null, null, "", false, List.of());
    }

    @Test
    void listsServiceStates() throws Exception {
        when(reconciler.states()).thenReturn(List.of(view("db", HealthStatus.HEALTHY), view("api", HealthStatus.DOWN)));

        mockMvc.perform(get("/api/reconciler/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].serviceId").value("db"))
                .andExpect(jsonPath("$[1].status").value("DOWN"));
    }

    @Test
    void unknownServiceIs404() throws Exception {
        when(reconciler.state("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/reconciler/services/ghost")).andExpect(status().isNotFound());
    }

    @Test
    void resetReturnsNewState() throws Exception {
        when(reconciler.reset("mlx")).thenReturn(Optional.of(view("mlx", HealthStatus.UNKNOWN)));

        mockMvc.perform(post("/api/reconciler/services/mlx/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNKNOWN"));
    }

    @Test
    void manualTickReturnsReport() throws Exception {
        when(reconciler.tryTick("manual")).thenReturn(Optional.of(new TickReport(7, "manual", NOW, NOW,
                true, false, 1, List.of(), Map.of("db", HealthStatus.HEALTHY))));

        mockMvc.perform(post("/api/reconciler/tick"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tickId").value(7))
                .andExpect(jsonPath("$.statuses.db").value("HEALTHY"));
    }

    @Test
    void tickWhileBusyIsConflict() throws Exception {
        when(reconciler.tryTick("manual")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/reconciler/tick")).andExpect(status().isConflict());
    }

    @Test
    void reloadListsServices() throws Exception {
        when(reconciler.reload()).thenReturn(List.of(TestSpecs.process("db"), TestSpecs.process("api", "db")));

        mockMvc.perform(post("/api/reconciler/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.services[1]").value("api"));
    }

    @Test
    void invalidRegistryOnReloadIsBadRequest() throws Exception {
        when(reconciler.reload()).thenThrow(new ConfigException("Dependency cycle among services [a, b]"));

        mockMvc.perform(post("/api/reconciler/reload"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Dependency cycle among services [a, b]"));
    }

    @Test
    void auditLimitIsClamped() throws Exception {
        when(auditLog.recent(1000)).thenReturn(List.of(
                ActionRecord.of(NOW, 1, "db", AuditEventKind.PROBE, "HEALTHY", "HTTP 200")));

        mockMvc.perform(get("/api/reconciler/audit").param("limit", "50000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("probe"));
        verify(auditLog).recent(1000);
    }
}
