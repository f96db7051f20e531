package com.example.servicereconciler.driver;

import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.ServiceSpec;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Shared plumbing for drivers whose actions are external commands and whose liveness can be
 * polled: idempotent start, stop-if-running then start, and the bounded settle wait.
 */
@Slf4j
public abstract class AbstractCommandDriver implements ServiceDriver {

    protected final CommandRunner commandRunner;
    protected final EndpointChecker endpointChecker;

    protected AbstractCommandDriver(CommandRunner commandRunner, EndpointChecker endpointChecker) {
        this.commandRunner = commandRunner;
        this.endpointChecker = endpointChecker;
    }

    @Override
    public CheckOutcome shallow(ServiceSpec spec) {
        if (spec.healthCheck().shallow() == null) {
            return CheckOutcome.pass("no shallow check defined");
        }
        return endpointChecker.shallow(spec.healthCheck().shallow());
    }

    @Override
    public ActionOutcome apply(ServiceSpec spec, ActionKind action) {
        return switch (action) {
            case START -> start(spec);
            case RESTART -> restart(spec);
            case RECONNECT -> ActionOutcome.failed(kind().wireName() + " services do not support " + action);
        };
    }

    /** Start-or-noop. */
    protected ActionOutcome start(ServiceSpec spec) {
        CheckOutcome live = liveness(spec);
        if (live.passed()) {
            return ActionOutcome.alreadyRunning("already running: " + live.detail());
        }
        return launch(spec);
    }

    protected ActionOutcome restart(ServiceSpec spec) {
        if (liveness(spec).passed()) {
            ActionOutcome stopped = stop(spec);
            if (!stopped.succeeded()) {
                return stopped;
            }
        }
        return launch(spec);
    }

    /** Runs the start command and waits for liveness. */
    protected ActionOutcome launch(ServiceSpec spec) {
        List<String> command = startCommand(spec);
        CommandResult result = commandRunner.run(command, commandTimeout(spec));
        if (!result.succeeded()) {
            return ActionOutcome.failed("start command failed (" + result.describe() + ")");
        }
        boolean up = Polling.awaitCondition(() -> liveness(spec).passed(),
                spec.actions().maxWait(), spec.actions().pollInterval());
        if (!up) {
            return ActionOutcome.failed("not running " + spec.actions().maxWait().toSeconds() + "s after start");
        }
        return ActionOutcome.succeeded("started");
    }

    /** Runs the stop command and waits for the unit to disappear. */
    protected ActionOutcome stop(ServiceSpec spec) {
        List<String> command = stopCommand(spec);
        CommandResult result = commandRunner.run(command, commandTimeout(spec));
        log.debug("Stop {} -> {}", spec.id(), result.describe());
        boolean gone = Polling.awaitCondition(() -> !liveness(spec).passed(),
                spec.actions().maxWait(), spec.actions().pollInterval());
        if (!gone) {
            return ActionOutcome.failed("still running " + spec.actions().maxWait().toSeconds()
                    + "s after stop (" + result.describe() + ")");
        }
        return ActionOutcome.succeeded("stopped");
    }

    protected CheckOutcome runLivenessCommand(ServiceSpec spec, List<String> command) {
        CommandResult result = commandRunner.run(command, spec.healthCheck().timeout());
        if (result.timedOut()) {
            return CheckOutcome.fail("liveness command timed out after " + spec.healthCheck().timeout().toMillis() + "ms");
        }
        return result.succeeded()
                ? CheckOutcome.pass("liveness command " + result.describe())
                : CheckOutcome.fail("liveness command " + result.describe());
    }

    protected Duration commandTimeout(ServiceSpec spec) {
        Duration floor = spec.healthCheck().timeout();
        Duration wait = spec.actions().maxWait();
        return wait.compareTo(floor) > 0 ? wait : floor;
    }

    protected abstract List<String> startCommand(ServiceSpec spec);

    protected abstract List<String> stopCommand(ServiceSpec spec);
}
