package com.example.servicereconciler.driver;

import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceSpec;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain OS processes located by command-line pattern, e.g. a local inference server.
 */
@Component
public class ProcessDriver extends AbstractCommandDriver {

    public ProcessDriver(CommandRunner commandRunner, EndpointChecker endpointChecker) {
        super(commandRunner, endpointChecker);
    }

    @Override
    public ServiceKind kind() {
        return ServiceKind.PROCESS;
    }

    @Override
    public CheckOutcome liveness(ServiceSpec spec) {
        return processLiveness(spec);
    }

    CheckOutcome processLiveness(ServiceSpec spec) {
        var liveness = spec.healthCheck().liveness();
        if (!liveness.command().isEmpty()) {
            return runLivenessCommand(spec, liveness.command());
        }
        CommandResult result = commandRunner.run(List.of("pgrep", "-f", liveness.processPattern()),
                spec.healthCheck().timeout());
        if (result.succeeded()) {
            return CheckOutcome.pass("process '" + liveness.processPattern() + "' running (pid "
                    + result.output().trim().replace('\n', ',') + ")");
        }
        if (result.timedOut()) {
            return CheckOutcome.fail("process lookup timed out");
        }
        return CheckOutcome.fail("no process matching '" + liveness.processPattern() + "'");
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
