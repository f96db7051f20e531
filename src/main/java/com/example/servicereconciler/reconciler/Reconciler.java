package com.example.servicereconciler.reconciler;

import com.example.servicereconciler.action.ActionExecutor;
import com.example.servicereconciler.audit.AuditLog;
import com.example.servicereconciler.budget.RestartBudgetTracker;
import com.example.servicereconciler.config.ReconcilerProperties;
import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.ActionRecord;
import com.example.servicereconciler.domain.AuditEventKind;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceRuntimeState;
import com.example.servicereconciler.domain.ServiceRuntimeState.ServiceStateView;
import com.example.servicereconciler.domain.ServiceSpec;
import com.example.servicereconciler.monitoring.HealthProber;
import com.example.servicereconciler.monitoring.ProbeResult;
import com.example.servicereconciler.notification.EscalationNotifier;
import com.example.servicereconciler.registry.ServiceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * The control loop. Each tick compares every registered service against "running and healthy"
 * and drives divergence back through corrective actions:
 * <ol>
 *   <li>connectivity gate; when it stays unhealthy, services that need the network are skipped</li>
 *   <li>dependency waves in order; probes within a wave run concurrently on a bounded pool</li>
 *   <li>unhealthy services are repaired one at a time in wave order, only when every predecessor
 *       is healthy and restart budget remains; each repair is followed by one re-probe</li>
 *   <li>a failure streak reaching its threshold, or budget exhaustion, escalates once</li>
 * </ol>
 * Ticks never overlap. Runtime state is written only by the thread holding the tick lock;
 * probe and action workers hand their results back to it.
 */
@Slf4j
@Service
public class Reconciler {

    private final ServiceRegistry registry;
    private final HealthProber prober;
    private final ActionExecutor executor;
    private final RestartBudgetTracker budgets;
    private final EscalationNotifier notifier;
    private final AuditLog auditLog;
    private final ReconcilerProperties properties;
    private final AsyncTaskExecutor workers;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ReentrantLock tickLock = new ReentrantLock();
    private final Map<String, ServiceRuntimeState> states = new ConcurrentHashMap<>();
    private final AtomicLong tickCounter = new AtomicLong();

    public Reconciler(ServiceRegistry registry,
                      HealthProber prober,
                      ActionExecutor executor,
                      RestartBudgetTracker budgets,
                      EscalationNotifier notifier,
                      AuditLog auditLog,
                      ReconcilerProperties properties,
                      @Qualifier("probeExecutor") AsyncTaskExecutor workers,
                      MeterRegistry meterRegistry,
                      Clock clock) {
        this.registry = registry;
        this.prober = prober;
        this.executor = executor;
        this.budgets = budgets;
        this.notifier = notifier;
        this.auditLog = auditLog;
        this.properties = properties;
        this.workers = workers;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        syncStates(registry.ordered());
    }

    /**
     * Runs one tick unless another is in progress, in which case the trigger is dropped.
     */
    public Optional<TickReport> tryTick(String trigger) {
        if (!tickLock.tryLock()) {
            log.warn("Tick trigger '{}' dropped: previous tick still running", trigger);
            meterRegistry.counter("reconciler.tick.skipped").increment();
            audit(0, ActionRecord.TICK_WIDE, AuditEventKind.SKIP, "dropped",
                    "tick trigger '" + trigger + "' dropped: previous tick still running");
            return Optional.empty();
        }
        try {
            return Optional.of(runTick(trigger));
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Re-reads the registry between ticks. States of surviving services are kept, new services
     * start as {@code UNKNOWN}, removed ones are forgotten.
     *
     * @throws com.example.servicereconciler.registry.ConfigException if the new registry is invalid;
     *                                                              nothing changes in that case
     */
    public List<ServiceSpec> reload() {
        tickLock.lock();
        try {
            List<ServiceSpec> loaded = registry.reload();
            syncStates(loaded);
            return loaded;
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Operator reset: clears the budget history, failure streak and escalation latch, so a
     * quarantined service is acted on again from the next tick.
     */
    public Optional<ServiceStateView> reset(String serviceId) {
        tickLock.lock();
        try {
            ServiceRuntimeState state = states.get(serviceId);
            if (state == null) {
                return Optional.empty();
            }
            HealthStatus previous = state.getStatus();
            state.reset();
            budgets.reset(serviceId);
            audit(0, serviceId, AuditEventKind.RESET, "reset", "operator reset from " + previous);
            log.info("Service {} reset by operator (was {})", serviceId, previous);
            return Optional.of(state.view());
        } finally {
            tickLock.unlock();
        }
    }

    public List<ServiceStateView> states() {
        return registry.ordered().stream()
                .map(spec -> states.get(spec.id()))
                .filter(Objects::nonNull)
                .map(ServiceRuntimeState::view)
                .toList();
    }

    public Optional<ServiceStateView> state(String serviceId) {
        return Optional.ofNullable(states.get(serviceId)).map(ServiceRuntimeState::view);
    }

    public boolean isTickRunning() {
        return tickLock.isLocked();
    }

    // ---------------------------------------------------------------- tick

    private TickReport runTick(String trigger) {
        Timer.Sample sample = Timer.start(meterRegistry);
        TickContext ctx = new TickContext(tickCounter.incrementAndGet(),
                System.nanoTime() + properties.getTick().getBudget().toNanos());
        Instant startedAt = clock.instant();
        log.info("Tick {} started ({})", ctx.tickId, trigger);

        boolean networkAvailable = runConnectivityGate(ctx);

        for (List<ServiceSpec> wave : registry.waves()) {
            List<ServiceSpec> members = wave.stream()
                    .filter(spec -> spec.kind() != ServiceKind.CONNECTIVITY)
                    .toList();
            if (members.isEmpty()) {
                continue;
            }
            if (ctx.expired()) {
                abandon(ctx, members, "tick budget exhausted before wave was probed");
                break;
            }
            runWave(ctx, members, networkAvailable);
            if (ctx.timedOut) {
                break;
            }
        }

        Instant finishedAt = clock.instant();
        Map<String, HealthStatus> statuses = new LinkedHashMap<>();
        for (ServiceSpec spec : registry.ordered()) {
            ServiceRuntimeState state = states.get(spec.id());
            if (state != null) statuses.put(spec.id(), state.getStatus());
        }
        sample.stop(Timer.builder("reconciler.tick.duration")
                .tag("outcome", ctx.timedOut ? "timed_out" : "completed")
                .register(meterRegistry));

        if (ctx.timedOut) {
            log.warn("Tick {} aborted after exceeding its {} budget", ctx.tickId, properties.getTick().getBudget());
        }
        log.info("Tick {} finished: {} actions, {} escalations, network {}",
                ctx.tickId, ctx.actions, ctx.escalated.size(), networkAvailable ? "up" : "down");
        return new TickReport(ctx.tickId, trigger, startedAt, finishedAt, networkAvailable, ctx.timedOut,
                ctx.actions, List.copyOf(ctx.escalated), statuses);
    }

    /**
     * Reconciles every connectivity service first. Without one the network is assumed up.
     */
    private boolean runConnectivityGate(TickContext ctx) {
        boolean available = true;
        for (ServiceSpec spec : registry.ordered()) {
            if (spec.kind() != ServiceKind.CONNECTIVITY) continue;
            probeWithin(ctx, spec).ifPresent(result -> settle(ctx, spec, result));
            if (!states.get(spec.id()).getStatus().isHealthy()) {
                available = false;
            }
        }
        if (!available) {
            log.warn("Tick {}: network unavailable, services that need it are skipped", ctx.tickId);
            audit(ctx.tickId, ActionRecord.TICK_WIDE, AuditEventKind.SKIP, "network-unavailable",
                    "connectivity gate unhealthy; network-dependent services keep their last status");
        }
        return available;
    }

    private void runWave(TickContext ctx, List<ServiceSpec> members, boolean networkAvailable) {
        Map<ServiceSpec, Future<ProbeResult>> pending = new LinkedHashMap<>();
        for (ServiceSpec spec : members) {
            if (spec.requiresNetwork() && !networkAvailable) {
                audit(ctx.tickId, spec.id(), AuditEventKind.SKIP, states.get(spec.id()).getStatus().name(),
                        "network unavailable; keeping last known status");
                continue;
            }
            pending.put(spec, workers.submit(() -> prober.probe(spec)));
        }

        Map<ServiceSpec, ProbeResult> resolved = new LinkedHashMap<>();
        List<ServiceSpec> unresolved = new ArrayList<>();
        for (Map.Entry<ServiceSpec, Future<ProbeResult>> entry : pending.entrySet()) {
            ServiceSpec spec = entry.getKey();
            Future<ProbeResult> future = entry.getValue();
            try {
                resolved.put(spec, future.get(ctx.remainingNanos(), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                unresolved.add(spec);
            } catch (ExecutionException e) {
                resolved.put(spec, internalProbeError(ctx, spec, e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                unresolved.add(spec);
            }
        }
        if (!unresolved.isEmpty()) {
            abandon(ctx, unresolved, "probe still running when tick budget was exhausted");
        }

        // actions are serialized, in wave order
        for (Map.Entry<ServiceSpec, ProbeResult> entry : resolved.entrySet()) {
            settle(ctx, entry.getKey(), entry.getValue());
        }
    }

    /**
     * Applies one probe result and, if warranted, one corrective action followed by a re-probe.
     * Any defect is contained here so it cannot affect other services.
     */
    private void settle(TickContext ctx, ServiceSpec spec, ProbeResult probe) {
        ServiceRuntimeState state = states.get(spec.id());
        try {
            Instant now = clock.instant();
            state.pruneHistory(now.minus(spec.restartBudget().window()));
            recordProbe(ctx, state, probe);

            if (probe.status().isHealthy()) {
                onHealthy(ctx, spec, state, probe);
                return;
            }

            if (state.getStatus() == HealthStatus.QUARANTINED && budgets.isQuarantined(spec.id(), now)) {
                state.setLastDetail(probe.describe());
                audit(ctx.tickId, spec.id(), AuditEventKind.SKIP, HealthStatus.QUARANTINED.name(),
                        "quarantined until " + budgets.nextRelease(spec.id(), now).map(Instant::toString).orElse("reset")
                                + "; observed " + probe.status() + ": " + probe.describe());
                return;
            }

            state.setStatus(probe.status());
            state.setLastDetail(probe.describe());

            Optional<String> blocker = unmetDependency(spec);
            if (blocker.isPresent()) {
                String dep = blocker.get();
                audit(ctx.tickId, spec.id(), AuditEventKind.SKIP, probe.status().name(),
                        "repair deferred: dependency " + dep + " is " + states.get(dep).getStatus());
                log.info("Service {} is {} but dependency {} is not healthy; repair deferred",
                        spec.id(), probe.status(), dep);
                return;
            }

            if (ctx.expired()) {
                ctx.timedOut = true;
                audit(ctx.tickId, spec.id(), AuditEventKind.TIMEOUT, probe.status().name(),
                        "tick budget exhausted before repair");
                return;
            }

            if (budgets.remaining(spec.id(), now) == 0) {
                quarantine(ctx, spec, state, probe.describe());
                return;
            }

            repair(ctx, spec, state, probe);
        } catch (RuntimeException e) {
            log.error("Controller error while reconciling {}: {}", spec.id(), e.getMessage(), e);
            state.setStatus(HealthStatus.DOWN);
            state.setLastDetail("controller error: " + e);
            audit(ctx.tickId, spec.id(), AuditEventKind.ERROR, HealthStatus.DOWN.name(), "controller error: " + e);
        }
    }

    private void repair(TickContext ctx, ServiceSpec spec, ServiceRuntimeState state, ProbeResult probe) {
        ActionKind action = executor.actionFor(spec, probe.status());
        Instant actedAt = clock.instant();
        state.setStatus(HealthStatus.RECOVERING);
        budgets.record(spec.id(), actedAt);

        ActionOutcome outcome = actWithin(ctx, spec, action);
        state.recordAction(actedAt, action, outcome.succeeded());
        ctx.actions++;
        audit(ctx.tickId, spec.id(), AuditEventKind.ACTION, outcome.resultName(),
                action + " (was " + probe.status() + "): " + outcome.reason());

        Optional<ProbeResult> reprobe = probeWithin(ctx, spec);
        if (reprobe.isEmpty()) {
            state.setStatus(probe.status());
            state.setLastDetail(action + " " + outcome.resultName() + " (" + outcome.reason()
                    + "), outcome unknown: tick budget exhausted");
            return;
        }
        ProbeResult after = reprobe.get();
        recordProbe(ctx, state, after);
        if (after.status().isHealthy()) {
            onHealthy(ctx, spec, state, after);
            return;
        }

        state.setStatus(after.status());
        state.setConsecutiveFailures(state.getConsecutiveFailures() + 1);
        String detail = action + " " + outcome.resultName() + " (" + outcome.reason() + "), still "
                + after.status() + ": " + after.describe();
        state.setLastDetail(detail);
        log.warn("Service {} still {} after {} (failure {} in a row)",
                spec.id(), after.status(), action, state.getConsecutiveFailures());

        if (budgets.remaining(spec.id(), clock.instant()) == 0) {
            quarantine(ctx, spec, state, detail);
        } else if (state.getConsecutiveFailures() >= spec.escalateAfter()) {
            escalateOnce(ctx, spec, state,
                    state.getConsecutiveFailures() + " consecutive failed repairs; last: " + detail);
        }
    }

    private void quarantine(TickContext ctx, ServiceSpec spec, ServiceRuntimeState state, String detail) {
        Instant now = clock.instant();
        state.setStatus(HealthStatus.QUARANTINED);
        String until = budgets.nextRelease(spec.id(), now).map(Instant::toString).orElse("reset");
        String message = String.format("restart budget exhausted (%d actions per %s); quarantined until %s; last: %s",
                spec.restartBudget().maxActions(), spec.restartBudget().window(), until, detail);
        state.setLastDetail(message);
        audit(ctx.tickId, spec.id(), AuditEventKind.SKIP, HealthStatus.QUARANTINED.name(), message);
        log.warn("Service {} quarantined: {}", spec.id(), message);
        escalateOnce(ctx, spec, state, message);
    }

    /** Edge-triggered: at most one escalation per failure streak. */
    private void escalateOnce(TickContext ctx, ServiceSpec spec, ServiceRuntimeState state, String detail) {
        if (state.isEscalated()) {
            return;
        }
        state.setEscalated(true);
        ctx.escalated.add(spec.id());
        audit(ctx.tickId, spec.id(), AuditEventKind.ESCALATION, state.getStatus().name(), detail);
        notifier.escalate(spec.id(), state.getStatus(), detail);
    }

    private void onHealthy(TickContext ctx, ServiceSpec spec, ServiceRuntimeState state, ProbeResult probe) {
        HealthStatus previous = state.getStatus();
        boolean wasEscalated = state.isEscalated();
        state.markHealthy(probe.probedAt(), probe.describe());
        state.setEscalated(false);
        if (previous != HealthStatus.HEALTHY && previous != HealthStatus.UNKNOWN) {
            log.info("Service {} healthy again (was {})", spec.id(), previous);
        }
        if (wasEscalated) {
            audit(ctx.tickId, spec.id(), AuditEventKind.RECOVERY, HealthStatus.HEALTHY.name(),
                    "recovered after escalation: " + probe.describe());
            if (properties.getEscalation().isNotifyOnRecovery()) {
                notifier.recovered(spec.id(), probe.describe());
            }
        }
    }

    private Optional<String> unmetDependency(ServiceSpec spec) {
        for (String dep : spec.dependsOn()) {
            ServiceRuntimeState predecessor = states.get(dep);
            if (predecessor == null || !predecessor.getStatus().isHealthy()) {
                return Optional.of(dep);
            }
        }
        return Optional.empty();
    }

    private void recordProbe(TickContext ctx, ServiceRuntimeState state, ProbeResult probe) {
        state.setLastProbeAt(probe.probedAt());
        audit(ctx.tickId, probe.serviceId(), AuditEventKind.PROBE, probe.status().name(), probe.describe());
    }

    // ------------------------------------------------------- bounded calls

    /**
     * Empty when the tick deadline prevented an actual probe. The timeout is audited here and the
     * caller keeps the service at its last known status.
     */
    private Optional<ProbeResult> probeWithin(TickContext ctx, ServiceSpec spec) {
        if (ctx.expired()) {
            abandon(ctx, List.of(spec), "tick budget exhausted before probe");
            return Optional.empty();
        }
        try {
            return Optional.of(callWithin(ctx, () -> prober.probe(spec)));
        } catch (TimeoutException e) {
            abandon(ctx, List.of(spec), "probe still running when tick budget was exhausted");
            return Optional.empty();
        } catch (ExecutionException e) {
            return Optional.of(internalProbeError(ctx, spec, e.getCause()));
        }
    }

    private ActionOutcome actWithin(TickContext ctx, ServiceSpec spec, ActionKind action) {
        try {
            return callWithin(ctx, () -> executor.apply(spec, action));
        } catch (TimeoutException e) {
            ctx.timedOut = true;
            audit(ctx.tickId, spec.id(), AuditEventKind.TIMEOUT, action.name(), "action still running when tick budget was exhausted");
            return ActionOutcome.failed("interrupted: tick budget exhausted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Controller error while applying {} to {}: {}", action, spec.id(), cause.getMessage(), cause);
            audit(ctx.tickId, spec.id(), AuditEventKind.ERROR, action.name(), "controller error: " + cause);
            return ActionOutcome.failed("controller error: " + cause);
        }
    }

    private <T> T callWithin(TickContext ctx, Callable<T> call) throws TimeoutException, ExecutionException {
        Future<T> future = workers.submit(call);
        try {
            return future.get(ctx.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TimeoutException("interrupted");
        }
    }

    private ProbeResult internalProbeError(TickContext ctx, ServiceSpec spec, Throwable cause) {
        log.error("Controller error while probing {}: {}", spec.id(), cause.getMessage(), cause);
        audit(ctx.tickId, spec.id(), AuditEventKind.ERROR, HealthStatus.DOWN.name(), "probe error: " + cause);
        return ProbeResult.internalError(spec.id(), clock.instant(), cause);
    }

    private void abandon(TickContext ctx, List<ServiceSpec> specs, String reason) {
        ctx.timedOut = true;
        String ids = specs.stream().map(ServiceSpec::id).collect(Collectors.joining(", "));
        log.warn("Tick {} timeout: {} [{}]", ctx.tickId, reason, ids);
        for (ServiceSpec spec : specs) {
            audit(ctx.tickId, spec.id(), AuditEventKind.TIMEOUT, states.get(spec.id()).getStatus().name(), reason);
        }
    }

    private void audit(long tickId, String serviceId, AuditEventKind kind, String result, String detail) {
        auditLog.append(ActionRecord.of(clock.instant(), tickId, serviceId, kind, result, detail));
    }

    private void syncStates(List<ServiceSpec> specs) {
        Set<String> ids = specs.stream().map(ServiceSpec::id).collect(Collectors.toSet());
        for (ServiceSpec spec : specs) {
            states.computeIfAbsent(spec.id(), ServiceRuntimeState::new);
            budgets.configure(spec.id(), spec.restartBudget());
        }
        states.keySet().retainAll(ids);
        budgets.retainOnly(ids);
    }

    private static final class TickContext {
        private final long tickId;
        private final long deadlineNanos;
        private final List<String> escalated = new ArrayList<>();
        private boolean timedOut;
        private int actions;

        private TickContext(long tickId, long deadlineNanos) {
            this.tickId = tickId;
            this.deadlineNanos = deadlineNanos;
        }

        boolean expired() {
            return System.nanoTime() >= deadlineNanos;
        }

        long remainingNanos() {
            return Math.max(0, deadlineNanos - System.nanoTime());
        }
    }
}
