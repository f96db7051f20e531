package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Network reachability gate settings.
 *
 * @param linkCheck           command whose output tells whether the interface is associated
 * @param associatedPattern   regex matched against that output; absent means "exit code 0"
 * @param disable             command that takes the interface down
 * @param enable              command that brings it back up
 * @param reachabilityTargets {@code host:port} pairs, any successful TCP connect counts
 * @param reachabilityUrl     HTTP fallback when no TCP target answers
 * @param bounceDelay         wait between disable and enable
 * @param maxWait             bound for waiting on association and on reachability retries
 * @param pollInterval        poll interval inside {@code maxWait}
 */
public record ConnectivitySpec(
        @JsonProperty("link-check") List<String> linkCheck,
        @JsonProperty("associated-pattern") String associatedPattern,
        List<String> disable,
        List<String> enable,
        @JsonProperty("reachability-targets") List<String> reachabilityTargets,
        @JsonProperty("reachability-url") String reachabilityUrl,
        @JsonProperty("bounce-delay") Duration bounceDelay,
        @JsonProperty("max-wait") Duration maxWait,
        @JsonProperty("poll-interval") Duration pollInterval
) {
    public static final List<String> DEFAULT_TARGETS = List.of("8.8.8.8:53", "1.1.1.1:53");

    public ConnectivitySpec {
        linkCheck = linkCheck == null ? List.of() : List.copyOf(linkCheck);
        disable = disable == null ? List.of() : List.copyOf(disable);
        enable = enable == null ? List.of() : List.copyOf(enable);
        reachabilityTargets = reachabilityTargets == null || reachabilityTargets.isEmpty()
                ? DEFAULT_TARGETS : List.copyOf(reachabilityTargets);
    }
}
