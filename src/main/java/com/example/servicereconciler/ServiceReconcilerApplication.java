package com.example.servicereconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Service Reconciler
 *
 * Self-healing controller for a fixed set of local services:
 * - Registry → service specs and dependency waves from YAML
 * - Health Prober → liveness, shallow and deep checks
 * - Connectivity Gate → link and reachability repair before anything else
 * - Reconciler → periodic tick, bounded repairs, quarantine, escalation
 * - Audit Log → append-only JSON lines
 */
@SpringBootApplication
@EnableScheduling
public class ServiceReconcilerApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         Service Reconciler v0.1.0                ║
            ║         Self-healing control loop                ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(ServiceReconcilerApplication.class, args);
    }
}
