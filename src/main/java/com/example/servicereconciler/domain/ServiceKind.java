package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of supervised unit kinds. Each kind has exactly one
 * {@link com.example.servicereconciler.driver.ServiceDriver} implementation.
 */
public enum ServiceKind {
    PROCESS("process"),
    CONTAINER("container"),
    NETWORK_TUNNEL("network-tunnel"),
    CONNECTIVITY("connectivity");

    private final String wireName;

    ServiceKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ServiceKind fromValue(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ServiceKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown service kind: " + value);
    }
}
