package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * At most {@code maxActions} corrective actions inside any rolling {@code window}.
 */
public record RestartBudget(
        @JsonProperty("max-actions") int maxActions,
        Duration window
) {
}
