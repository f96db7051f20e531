package com.example.servicereconciler.reconciler;

import com.example.servicereconciler.domain.HealthStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one reconciliation tick.
 *
 * @param networkAvailable false when the connectivity gate stayed unhealthy and network-dependent
 *                         services were skipped
 * @param timedOut         the tick hit its wall-clock budget and abandoned remaining work
 * @param statuses         status of every registered service when the tick ended, in dependency order
 */
public record TickReport(
        long tickId,
        String trigger,
        Instant startedAt,
        Instant finishedAt,
        boolean networkAvailable,
        boolean timedOut,
        int actionsDispatched,
        List<String> escalated,
        Map<String, HealthStatus> statuses
) {
}
