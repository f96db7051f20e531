package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Tiered health check: liveness, then shallow, then the optional deep check.
 * {@code timeout} applies to every tier that does not carry its own.
 */
public record HealthCheckSpec(
        LivenessCheck liveness,
        ShallowCheck shallow,
        DeepCheck deep,
        Duration timeout
) {

    /**
     * "Does the unit exist at all". Processes and tunnels are matched by command line pattern,
     * containers by name; {@code command} overrides both with an arbitrary exit-code check.
     */
    public record LivenessCheck(
            @JsonProperty("process-pattern") String processPattern,
            @JsonProperty("container-name") String containerName,
            List<String> command
    ) {
        public LivenessCheck {
            command = command == null ? List.of() : List.copyOf(command);
        }
    }

    /** HTTP GET when {@code url} is set, otherwise a TCP connect to {@code host:port}. */
    public record ShallowCheck(
            String url,
            String host,
            Integer port,
            Duration timeout
    ) {
        public boolean isHttp() {
            return url != null && !url.isBlank();
        }
    }

    /**
     * JSON status document whose object at {@code flagsPath} holds named boolean readiness flags.
     * An empty {@code requiredFlags} means every boolean in that object must be true.
     */
    public record DeepCheck(
            String url,
            @JsonProperty("flags-path") String flagsPath,
            @JsonProperty("required-flags") List<String> requiredFlags,
            Duration timeout
    ) {
        public DeepCheck {
            requiredFlags = requiredFlags == null ? List.of() : List.copyOf(requiredFlags);
        }
    }
}
