package com.example.servicereconciler.driver;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Bounded wait for an asynchronous repair to settle.
 */
public final class Polling {

    private Polling() {
    }

    /**
     * Evaluates {@code condition} until it holds or {@code maxWait} elapses. The condition is
     * always evaluated at least once. Returns {@code false} if the thread is interrupted.
     */
    public static boolean awaitCondition(BooleanSupplier condition, Duration maxWait, Duration pollInterval) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            if (condition.getAsBoolean()) {
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            try {
                Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /** Sleeps, returning {@code false} if interrupted. */
    public static boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
