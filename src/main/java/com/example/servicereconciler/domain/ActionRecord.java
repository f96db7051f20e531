package com.example.servicereconciler.domain;

import java.time.Instant;

/**
 * One audit log entry. Immutable once written.
 *
 * @param timestamp when the event happened
 * @param tickId    reconciliation tick that produced it, {@code 0} for events outside a tick
 * @param serviceId the service concerned, or {@code "*"} for tick-wide events
 * @param kind      event category
 * @param result    short machine-readable outcome (a status name, {@code succeeded}, {@code failed}...)
 * @param detail    free-form diagnostic text
 */
public record ActionRecord(
        Instant timestamp,
        long tickId,
        String serviceId,
        AuditEventKind kind,
        String result,
        String detail
) {
    public static final String TICK_WIDE = "*";

    public static ActionRecord of(Instant timestamp, long tickId, String serviceId,
                                  AuditEventKind kind, String result, String detail) {
        return new ActionRecord(timestamp, tickId, serviceId, kind, result, detail == null ? "" : detail);
    }
}
