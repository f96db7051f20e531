package com.example.servicereconciler.reconciler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic trigger. Fixed-rate so a slow tick does not push the schedule back; an overlapping
 * trigger is dropped by the reconciler itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "reconciler.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconcilerScheduler {

    private final Reconciler reconciler;

    @Scheduled(fixedRateString = "${reconciler.scheduling.interval:PT120S}",
            initialDelayString = "${reconciler.scheduling.initial-delay:PT0S}")
    public void onTimer() {
        try {
            reconciler.tryTick("timer");
        } catch (Exception e) {
            // keep the schedule alive
            log.error("Scheduled tick failed: {}", e.getMessage(), e);
        }
    }
}
