package com.example.servicereconciler.action;

import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.ServiceSpec;
import com.example.servicereconciler.driver.DriverRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies one corrective action to one service through its kind's driver and blocks until the
 * driver reports an outcome. There is no fire-and-forget action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionExecutor {

    private final DriverRegistry drivers;
    private final MeterRegistry meterRegistry;

    /** The action the service's kind uses to repair the given status. */
    public ActionKind actionFor(ServiceSpec spec, HealthStatus status) {
        return drivers.forKind(spec.kind()).repairActionFor(status);
    }

    public ActionOutcome apply(ServiceSpec spec, ActionKind action) {
        log.info("Applying {} to {} ({})", action, spec.id(), spec.kind().wireName());
        long start = System.currentTimeMillis();
        ActionOutcome outcome = drivers.forKind(spec.kind()).apply(spec, action);
        long duration = System.currentTimeMillis() - start;

        Counter.builder("reconciler.action.total")
                .tag("service", spec.id())
                .tag("action", action.name().toLowerCase())
                .tag("outcome", outcome.resultName())
                .register(meterRegistry)
                .increment();

        if (outcome.succeeded()) {
            log.info("{} {} {} in {}ms: {}", action, spec.id(), outcome.resultName(), duration, outcome.reason());
        } else {
            log.warn("{} {} failed after {}ms: {}", action, spec.id(), duration, outcome.reason());
        }
        return outcome;
    }
}
