package com.example.servicereconciler.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ServiceRuntimeStateTest {

    @Test
    void viewNeverMixesTwoUpdates() throws Exception {
        ServiceRuntimeState state = new ServiceRuntimeState("svc");
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        AtomicBoolean stop = new AtomicBoolean();
        state.reset();

        ExecutorService writer = Executors.newSingleThreadExecutor();
        try {
            Future<?> writes = writer.submit(() -> {
                while (!stop.get()) {
                    state.markHealthy(at, "ok");
                    state.reset();
                }
            });

            for (int i = 0; i < 50_000; i++) {
                ServiceRuntimeState.ServiceStateView view = state.view();
                if (view.status() == HealthStatus.HEALTHY) {
                    assertEquals("ok", view.lastDetail());
                } else {
                    assertEquals(HealthStatus.UNKNOWN, view.status());
                    assertEquals("reset by operator", view.lastDetail());
                }
                assertEquals(0, view.consecutiveFailures());
            }
            stop.set(true);
            writes.get(5, TimeUnit.SECONDS);
        } finally {
            writer.shutdownNow();
        }
    }

    @Test
    void historyIsPrunedAtTheCutoff() {
        ServiceRuntimeState state = new ServiceRuntimeState("svc");
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        state.recordAction(t0, ActionKind.START, false);
        state.recordAction(t0.plusSeconds(60), ActionKind.RESTART, true);

        state.pruneHistory(t0);

        assertEquals(1, state.view().actionHistory().size());
        assertEquals(ActionKind.RESTART, state.view().actionHistory().get(0).kind());
        assertEquals(t0.plusSeconds(60), state.view().lastActionAt());
    }
}
