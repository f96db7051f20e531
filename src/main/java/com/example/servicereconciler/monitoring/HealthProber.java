package com.example.servicereconciler.monitoring;

import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.ServiceSpec;
import com.example.servicereconciler.driver.DriverRegistry;
import com.example.servicereconciler.driver.EndpointChecker;
import com.example.servicereconciler.driver.ServiceDriver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs the tiered health check for one service: liveness, then shallow, then the optional deep
 * check, stopping at the first failing tier.
 * <p>
 * Liveness failure means {@code DOWN}; a later tier failing means {@code DEGRADED}.
 * An unreachable service is a status, never an exception. Every tier carries its own timeout,
 * and a timed-out tier counts as a failure of that tier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthProber {

    private final DriverRegistry drivers;
    private final EndpointChecker endpointChecker;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if no driver is registered for the service's kind
     */
    public ProbeResult probe(ServiceSpec spec) {
        ServiceDriver driver = drivers.forKind(spec.kind());
        if (driver == null) {
            throw new IllegalArgumentException("No driver for kind " + spec.kind() + " of service " + spec.id());
        }
        Instant at = clock.instant();
        long start = System.currentTimeMillis();

        ProbeResult result;
        CheckOutcome liveness = driver.liveness(spec);
        if (!liveness.passed()) {
            result = finish(spec, HealthStatus.DOWN, "liveness", liveness.detail(), at, start);
        } else {
            CheckOutcome shallow = driver.shallow(spec);
            if (!shallow.passed()) {
                result = finish(spec, HealthStatus.DEGRADED, "shallow", shallow.detail(), at, start);
            } else if (spec.hasDeepCheck()) {
                CheckOutcome deep = endpointChecker.deep(spec.healthCheck().deep());
                result = deep.passed()
                        ? finish(spec, HealthStatus.HEALTHY, null, deep.detail(), at, start)
                        : finish(spec, HealthStatus.DEGRADED, "deep", deep.detail(), at, start);
            } else {
                result = finish(spec, HealthStatus.HEALTHY, null, shallow.detail(), at, start);
            }
        }

        log.debug("Probe {} -> {} ({})", spec.id(), result.status(), result.describe());
        return result;
    }

    private ProbeResult finish(ServiceSpec spec, HealthStatus status, String tier, String detail,
                               Instant at, long start) {
        Counter.builder("reconciler.probe.total")
                .tag("service", spec.id())
                .tag("status", status.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        return new ProbeResult(spec.id(), status, tier, detail, at, System.currentTimeMillis() - start, false);
    }
}
