package com.example.servicereconciler.driver;

import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * SSH port-forward tunnels. A tunnel process can be alive and still invisible from the far end,
 * so both the shallow check and the repair outcome are decided by the remote endpoint check.
 */
@Slf4j
@Component
public class TunnelDriver extends AbstractCommandDriver {

    private final ProcessDriver processDriver;
    private final RemoteEndpointChecker remoteEndpointChecker;

    public TunnelDriver(CommandRunner commandRunner, EndpointChecker endpointChecker,
                        ProcessDriver processDriver, RemoteEndpointChecker remoteEndpointChecker) {
        super(commandRunner, endpointChecker);
        this.processDriver = processDriver;
        this.remoteEndpointChecker = remoteEndpointChecker;
    }

    @Override
    public ServiceKind kind() {
        return ServiceKind.NETWORK_TUNNEL;
    }

    @Override
    public CheckOutcome liveness(ServiceSpec spec) {
        return processDriver.processLiveness(spec);
    }

    @Override
    public CheckOutcome shallow(ServiceSpec spec) {
        if (spec.remoteEndpoint() != null) {
            return remoteEndpointChecker.check(spec.remoteEndpoint(), spec.healthCheck().timeout());
        }
        return super.shallow(spec);
    }

    /** Tunnels are always torn down and re-established. */
    @Override
    public ActionKind repairActionFor(HealthStatus status) {
        return ActionKind.RESTART;
    }

    @Override
    protected ActionOutcome start(ServiceSpec spec) {
        if (liveness(spec).passed() && shallow(spec).passed()) {
            return ActionOutcome.alreadyRunning("tunnel already established");
        }
        return restart(spec);
    }

    @Override
    protected ActionOutcome restart(ServiceSpec spec) {
        if (liveness(spec).passed()) {
            ActionOutcome stopped = stop(spec);
            if (!stopped.succeeded()) {
                return stopped;
            }
        }
        CommandResult result = commandRunner.run(spec.actions().start(), commandTimeout(spec));
        if (!result.succeeded()) {
            return ActionOutcome.failed("tunnel command failed (" + result.describe() + ")");
        }
        CheckOutcome[] last = {CheckOutcome.fail("remote endpoint not checked")};
        boolean visible = Polling.awaitCondition(() -> {
            last[0] = shallow(spec);
            return last[0].passed();
        }, spec.actions().maxWait(), spec.actions().pollInterval());
        if (!visible) {
            return ActionOutcome.failed("tunnel re-established but remote endpoint unreachable: " + last[0].detail());
        }
        log.info("Tunnel {} re-established: {}", spec.id(), last[0].detail());
        return ActionOutcome.succeeded("tunnel re-established");
    }

    @Override
    protected List<String> startCommand(ServiceSpec spec) {
        return spec.actions().start();
    }

    @Override
    protected List<String> stopCommand(ServiceSpec spec) {
        if (!spec.actions().stop().isEmpty()) {
            return spec.actions().stop();
        }
        return List.of("pkill", "-f", spec.healthCheck().liveness().processPattern());
    }
}
