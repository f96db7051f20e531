package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Corrective commands for a service, as argv lists. Empty lists fall back to the kind's defaults.
 */
public record ActionSpec(
        List<String> start,
        List<String> stop,
        List<String> restart,
        @JsonProperty("max-wait") Duration maxWait,
        @JsonProperty("poll-interval") Duration pollInterval
) {
    public ActionSpec {
        start = start == null ? List.of() : List.copyOf(start);
        stop = stop == null ? List.of() : List.copyOf(stop);
        restart = restart == null ? List.of() : List.copyOf(restart);
    }
}
