package com.example.servicereconciler.connectivity;

import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceSpec;
import com.example.servicereconciler.driver.ServiceDriver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exposes the {@link ConnectivityGate} through the common driver contract: link check as
 * liveness, external reachability as the shallow check, every repair through the gate's policy.
 */
@Component
@RequiredArgsConstructor
public class ConnectivityDriver implements ServiceDriver {

    private final ConnectivityGate gate;

    @Override
    public ServiceKind kind() {
        return ServiceKind.CONNECTIVITY;
    }

    @Override
    public CheckOutcome liveness(ServiceSpec spec) {
        return gate.checkLink(spec.connectivity(), spec.healthCheck().timeout());
    }

    @Override
    public CheckOutcome shallow(ServiceSpec spec) {
        return gate.checkReachability(spec.connectivity(), spec.healthCheck().timeout());
    }

    @Override
    public ActionOutcome apply(ServiceSpec spec, ActionKind action) {
        return gate.repair(spec.connectivity(), spec.healthCheck().timeout());
    }

    @Override
    public ActionKind repairActionFor(HealthStatus status) {
        return ActionKind.RECONNECT;
    }
}
