package com.example.servicereconciler.domain;

/**
 * Observed health of one supervised service.
 */
public enum HealthStatus {
    /** Never probed. */
    UNKNOWN,
    HEALTHY,
    /** Liveness passes, shallow or deep check fails. */
    DEGRADED,
    /** Liveness fails. */
    DOWN,
    /** A corrective action has been dispatched and its re-probe is pending. */
    RECOVERING,
    /** Restart budget exhausted; no automatic action until the window frees budget. */
    QUARANTINED;

    public boolean isHealthy() {
        return this == HEALTHY;
    }

    public boolean needsRepair() {
        return this == DEGRADED || this == DOWN;
    }
}
