package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditEventKind {
    PROBE,
    ACTION,
    ESCALATION,
    RECOVERY,
    SKIP,
    TIMEOUT,
    ERROR,
    RESET;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditEventKind fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
