package com.example.servicereconciler.budget;

import com.example.servicereconciler.domain.RestartBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RestartBudgetTrackerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private RestartBudgetTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new RestartBudgetTracker();
        tracker.configure("svc", new RestartBudget(3, Duration.ofMinutes(60)));
    }

    @Test
    void freshServiceHasFullBudget() {
        assertEquals(3, tracker.remaining("svc", T0));
        assertFalse(tracker.isQuarantined("svc", T0));
        assertEquals(Optional.empty(), tracker.nextRelease("svc", T0));
    }

    @Test
    void quarantinedOnceEveryActionIsUsed() {
        tracker.record("svc", T0);
        tracker.record("svc", T0.plusSeconds(60));
        assertEquals(1, tracker.remaining("svc", T0.plusSeconds(120)));

        tracker.record("svc", T0.plusSeconds(120));

        assertEquals(0, tracker.remaining("svc", T0.plusSeconds(121)));
        assertTrue(tracker.isQuarantined("svc", T0.plusSeconds(121)));
        assertEquals(Optional.of(T0.plus(Duration.ofMinutes(60))), tracker.nextRelease("svc", T0.plusSeconds(121)));
    }

    @Test
    void actionsLeaveTheWindowOneAtATime() {
        tracker.record("svc", T0);
        tracker.record("svc", T0.plus(Duration.ofMinutes(20)));
        tracker.record("svc", T0.plus(Duration.ofMinutes(40)));

        assertEquals(0, tracker.remaining("svc", T0.plus(Duration.ofMinutes(59))));
        // exactly one window after the first action it no longer counts
        assertEquals(1, tracker.remaining("svc", T0.plus(Duration.ofMinutes(60))));
        assertEquals(1, tracker.remaining("svc", T0.plus(Duration.ofMinutes(79))));
        assertEquals(2, tracker.remaining("svc", T0.plus(Duration.ofMinutes(80))));
        assertEquals(3, tracker.remaining("svc", T0.plus(Duration.ofMinutes(100))));
    }

    @Test
    void usedNeverExceedsRecordedActionsInsideWindow() {
        for (int i = 0; i < 10; i++) {
            tracker.record("svc", T0.plus(Duration.ofMinutes(10L * i)));
        }
        Instant now = T0.plus(Duration.ofMinutes(95));
        // actions at 40..90 are inside (35, 95]
        assertEquals(6, tracker.used("svc", now));
        assertEquals(0, tracker.remaining("svc", now));
    }

    @Test
    void resetClearsHistory() {
        tracker.record("svc", T0);
        tracker.record("svc", T0);
        tracker.record("svc", T0);

        tracker.reset("svc");

        assertEquals(3, tracker.remaining("svc", T0));
    }

    @Test
    void retainOnlyForgetsRemovedServices() {
        tracker.configure("gone", new RestartBudget(1, Duration.ofMinutes(1)));
        tracker.retainOnly(List.of("svc"));

        assertThrows(IllegalStateException.class, () -> tracker.remaining("gone", T0));
        assertEquals(3, tracker.remaining("svc", T0));
    }

    @Test
    void reconfigureKeepsHistory() {
        tracker.record("svc", T0);
        tracker.configure("svc", new RestartBudget(1, Duration.ofMinutes(60)));

        assertTrue(tracker.isQuarantined("svc", T0.plusSeconds(1)));
    }
}
