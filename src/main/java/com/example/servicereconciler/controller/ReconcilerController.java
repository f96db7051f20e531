package com.example.servicereconciler.controller;

import com.example.servicereconciler.audit.AuditLog;
import com.example.servicereconciler.domain.ActionRecord;
import com.example.servicereconciler.domain.ServiceRuntimeState.ServiceStateView;
import com.example.servicereconciler.domain.ServiceSpec;
import com.example.servicereconciler.reconciler.Reconciler;
import com.example.servicereconciler.reconciler.TickReport;
import com.example.servicereconciler.registry.ConfigException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Operator REST API: inspect state, trigger a tick, reload the registry, lift a quarantine.
 */
@Slf4j
@RestController
@RequestMapping("/api/reconciler")
@RequiredArgsConstructor
public class ReconcilerController {

    private final Reconciler reconciler;
    private final AuditLog auditLog;

    /**
     * Current state of every registered service, in dependency order.
     */
    @GetMapping("/services")
    public ResponseEntity<List<ServiceStateView>> listServices() {
        return ResponseEntity.ok(reconciler.states());
    }

    @GetMapping("/services/{id}")
    public ResponseEntity<ServiceStateView> getService(@PathVariable String id) {
        return reconciler.state(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Clear restart budget, failure streak and escalation latch for a service.
     */
    @PostMapping("/services/{id}/reset")
    public ResponseEntity<ServiceStateView> resetService(@PathVariable String id) {
        return reconciler.reset(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Run a tick now. Answers 409 when one is already in progress.
     */
    @PostMapping("/tick")
    public ResponseEntity<?> tick() {
        return reconciler.tryTick("manual")
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "a reconciliation tick is already running")));
    }

    /**
     * Re-read the registry file. An invalid registry is rejected and the current one stays active.
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        try {
            List<ServiceSpec> loaded = reconciler.reload();
            return ResponseEntity.ok(Map.of(
                    "status", "reloaded",
                    "services", loaded.stream().map(ServiceSpec::id).toList()));
        } catch (ConfigException e) {
            log.warn("Registry reload rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/audit")
    public ResponseEntity<List<ActionRecord>> audit(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditLog.recent(Math.max(1, Math.min(limit, 1000))));
    }
}
