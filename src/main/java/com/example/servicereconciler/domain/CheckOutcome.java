package com.example.servicereconciler.domain;

/**
 * Result of one check tier. Unreachable or timed-out targets are failures, not exceptions.
 */
public record CheckOutcome(boolean passed, String detail) {

    public static CheckOutcome pass(String detail) {
        return new CheckOutcome(true, detail);
    }

    public static CheckOutcome fail(String detail) {
        return new CheckOutcome(false, detail);
    }
}
