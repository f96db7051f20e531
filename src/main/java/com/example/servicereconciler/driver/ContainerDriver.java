package com.example.servicereconciler.driver;

import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceSpec;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Docker containers. Defaults to {@code docker start|stop|restart <name>}; compose-based setups
 * override the commands in the registry.
 */
@Component
public class ContainerDriver extends AbstractCommandDriver {

    public ContainerDriver(CommandRunner commandRunner, EndpointChecker endpointChecker) {
        super(commandRunner, endpointChecker);
    }

    @Override
    public ServiceKind kind() {
        return ServiceKind.CONTAINER;
    }

    @Override
    public CheckOutcome liveness(ServiceSpec spec) {
        var liveness = spec.healthCheck().liveness();
        if (!liveness.command().isEmpty()) {
            return runLivenessCommand(spec, liveness.command());
        }
        String name = liveness.containerName();
        CommandResult result = commandRunner.run(
                List.of("docker", "inspect", "--format", "{{.State.Status}}", name),
                spec.healthCheck().timeout());
        if (result.timedOut()) {
            return CheckOutcome.fail("docker inspect timed out");
        }
        String state = result.output() == null ? "" : result.output().trim();
        if (result.succeeded() && "running".equals(state)) {
            return CheckOutcome.pass("container " + name + ": running");
        }
        return CheckOutcome.fail("container " + name + ": " + (state.isEmpty() ? result.describe() : state));
    }

    /**
     * {@code docker restart} also starts a stopped container, so the explicit restart command
     * is used when no separate stop command is configured.
     */
    @Override
    protected ActionOutcome restart(ServiceSpec spec) {
        if (!spec.actions().stop().isEmpty() && spec.actions().restart().isEmpty()) {
            return super.restart(spec);
        }
        List<String> command = !spec.actions().restart().isEmpty()
                ? spec.actions().restart()
                : List.of("docker", "restart", spec.healthCheck().liveness().containerName());
        CommandResult result = commandRunner.run(command, commandTimeout(spec));
        if (!result.succeeded()) {
            return ActionOutcome.failed("restart command failed (" + result.describe() + ")");
        }
        boolean up = Polling.awaitCondition(() -> liveness(spec).passed(),
                spec.actions().maxWait(), spec.actions().pollInterval());
        return up ? ActionOutcome.succeeded("restarted")
                : ActionOutcome.failed("not running " + spec.actions().maxWait().toSeconds() + "s after restart");
    }

    @Override
    protected List<String> startCommand(ServiceSpec spec) {
        if (!spec.actions().start().isEmpty()) {
            return spec.actions().start();
        }
        return List.of("docker", "start", spec.healthCheck().liveness().containerName());
    }

    @Override
    protected List<String> stopCommand(ServiceSpec spec) {
        if (!spec.actions().stop().isEmpty()) {
            return spec.actions().stop();
        }
        return List.of("docker", "stop", spec.healthCheck().liveness().containerName());
    }
}
