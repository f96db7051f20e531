package com.example.servicereconciler.driver;

import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceSpec;

/**
 * Uniform probe/act contract for one {@link ServiceKind}.
 * Check methods report unreachability as a failed {@link CheckOutcome}; they throw only on
 * a defect in the check itself.
 */
public interface ServiceDriver {

    ServiceKind kind();

    /** Does the underlying unit exist at all. */
    CheckOutcome liveness(ServiceSpec spec);

    /** Does it respond on its well-known address. */
    CheckOutcome shallow(ServiceSpec spec);

    /** Applies one corrective action and blocks until it settles or its bounded wait expires. */
    ActionOutcome apply(ServiceSpec spec, ActionKind action);

    /**
     * The action the reconciler dispatches for an unhealthy status. A missing unit is started,
     * a present but unresponsive one is restarted.
     */
    default ActionKind repairActionFor(HealthStatus status) {
        return status == HealthStatus.DOWN ? ActionKind.START : ActionKind.RESTART;
    }
}
