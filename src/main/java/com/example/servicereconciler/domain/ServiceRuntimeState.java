package com.example.servicereconciler.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Mutable per-service state. Only the thread that owns the current reconciliation tick
 * writes to it; everyone else reads through {@link #view()}. All access goes through this
 * instance's monitor so a view never mixes fields from two updates.
 */
public class ServiceRuntimeState {

    @Getter
    private final String serviceId;
    private HealthStatus status = HealthStatus.UNKNOWN;
    private int consecutiveFailures;
    private Instant lastProbeAt;
    private Instant lastActionAt;
    private String lastDetail = "";

    /** Latched when a streak has been escalated; cleared on recovery. */
    private boolean escalated;

    private final Deque<ActionHistoryEntry> actionHistory = new ArrayDeque<>();

    public ServiceRuntimeState(String serviceId) {
        this.serviceId = serviceId;
    }

    public synchronized HealthStatus getStatus() {
        return status;
    }

    public synchronized void setStatus(HealthStatus status) {
        this.status = status;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public synchronized Instant getLastProbeAt() {
        return lastProbeAt;
    }

    public synchronized void setLastProbeAt(Instant lastProbeAt) {
        this.lastProbeAt = lastProbeAt;
    }

    public synchronized Instant getLastActionAt() {
        return lastActionAt;
    }

    public synchronized String getLastDetail() {
        return lastDetail;
    }

    public synchronized void setLastDetail(String lastDetail) {
        this.lastDetail = lastDetail;
    }

    public synchronized boolean isEscalated() {
        return escalated;
    }

    public synchronized void setEscalated(boolean escalated) {
        this.escalated = escalated;
    }

    public synchronized void recordAction(Instant at, ActionKind kind, boolean succeeded) {
        actionHistory.addLast(new ActionHistoryEntry(at, kind, succeeded));
        lastActionAt = at;
    }

    /** Drops history entries at or before {@code cutoff}. */
    public synchronized void pruneHistory(Instant cutoff) {
        while (!actionHistory.isEmpty() && !actionHistory.peekFirst().timestamp().isAfter(cutoff)) {
            actionHistory.removeFirst();
        }
    }

    public synchronized void markHealthy(Instant at, String detail) {
        status = HealthStatus.HEALTHY;
        consecutiveFailures = 0;
        lastProbeAt = at;
        lastDetail = detail;
    }

    /** Clears the failure streak, the escalation latch and the action history. */
    public synchronized void reset() {
        status = HealthStatus.UNKNOWN;
        consecutiveFailures = 0;
        escalated = false;
        actionHistory.clear();
        lastDetail = "reset by operator";
    }

    public synchronized ServiceStateView view() {
        return new ServiceStateView(serviceId, status, consecutiveFailures, lastProbeAt, lastActionAt,
                lastDetail, escalated, List.copyOf(actionHistory));
    }

    public record ActionHistoryEntry(Instant timestamp, ActionKind kind, boolean succeeded) {
    }

    public record ServiceStateView(
            String serviceId,
            HealthStatus status,
            int consecutiveFailures,
            Instant lastProbeAt,
            Instant lastActionAt,
            String lastDetail,
            boolean escalated,
            List<ActionHistoryEntry> actionHistory
    ) {
    }
}
