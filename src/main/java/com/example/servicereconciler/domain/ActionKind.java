package com.example.servicereconciler.domain;

public enum ActionKind {
    /** Idempotent start-or-noop. */
    START,
    /** Stop if running, then start. */
    RESTART,
    /** Connectivity repair through the gate's own policy. */
    RECONNECT
}
