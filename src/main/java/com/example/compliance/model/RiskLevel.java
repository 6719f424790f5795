package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Static risk classification of a compliance rule, copied onto every result it produces.
 */
public enum RiskLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    UNKNOWN("unknown");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
