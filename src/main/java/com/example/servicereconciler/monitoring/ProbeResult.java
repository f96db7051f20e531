package com.example.servicereconciler.monitoring;

import com.example.servicereconciler.domain.HealthStatus;

import java.time.Instant;

/**
 * Outcome of one tiered probe.
 *
 * @param failedTier {@code liveness}, {@code shallow}, {@code deep}, or {@code null} when healthy
 * @param internalError the check itself misbehaved; the status is then a conservative {@code DOWN}
 */
public record ProbeResult(
        String serviceId,
        HealthStatus status,
        String failedTier,
        String detail,
        Instant probedAt,
        long durationMs,
        boolean internalError
) {
    public static ProbeResult internalError(String serviceId, Instant at, Throwable error) {
        return new ProbeResult(serviceId, HealthStatus.DOWN, "internal",
                "controller error during probe: " + error, at, 0, true);
    }

    public String describe() {
        return failedTier == null ? detail : failedTier + " check failed: " + detail;
    }
}
