package com.example.servicereconciler.domain;

/**
 * Result of one corrective action. {@code noop} marks an idempotent start that found the unit
 * already running and did nothing.
 */
public record ActionOutcome(boolean succeeded, boolean noop, String reason) {

    public static ActionOutcome succeeded(String reason) {
        return new ActionOutcome(true, false, reason);
    }

    public static ActionOutcome alreadyRunning(String reason) {
        return new ActionOutcome(true, true, reason);
    }

    public static ActionOutcome failed(String reason) {
        return new ActionOutcome(false, false, reason);
    }

    public String resultName() {
        if (noop) return "noop";
        return succeeded ? "succeeded" : "failed";
    }
}
