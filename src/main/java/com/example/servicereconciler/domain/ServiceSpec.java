package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable description of one supervised unit, loaded from the registry file.
 * Instances handed out by the {@link com.example.servicereconciler.registry.ServiceRegistry}
 * have every optional value resolved against the configured defaults.
 */
public record ServiceSpec(
        String id,
        ServiceKind kind,
        String description,
        @JsonProperty("depends-on") List<String> dependsOn,
        @JsonProperty("requires-network") boolean requiresNetwork,
        @JsonProperty("health-check") HealthCheckSpec healthCheck,
        ActionSpec actions,
        @JsonProperty("restart-budget") RestartBudget restartBudget,
        @JsonProperty("escalate-after") int escalateAfter,
        @JsonProperty("remote-endpoint") RemoteEndpoint remoteEndpoint,
        ConnectivitySpec connectivity
) {
    public ServiceSpec {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public boolean hasDeepCheck() {
        return healthCheck != null && healthCheck.deep() != null;
    }

    public String displayName() {
        return description == null || description.isBlank() ? id : id + " (" + description + ")";
    }
}
