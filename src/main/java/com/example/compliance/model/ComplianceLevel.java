package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Graded verdict of a compliance assessment.
 * <p>
 * {@link #UNKNOWN} marks a rule that found no evidence in the evaluated text;
 * such results are discarded and never reach a report.
 */
public enum ComplianceLevel {
    COMPLIANT("compliant"),
    PARTIALLY_COMPLIANT("partially_compliant"),
    NON_COMPLIANT("non_compliant"),
    UNKNOWN("unknown");

    /** Lower bound (inclusive) of the COMPLIANT band. */
    public static final double COMPLIANT_THRESHOLD = 0.8;

    /** Lower bound (inclusive) of the PARTIALLY_COMPLIANT band. */
    public static final double PARTIAL_THRESHOLD = 0.5;

    private final String value;

    ComplianceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Maps a score in [0,1] to a level: {@code >= 0.8} compliant,
     * {@code >= 0.5} partially compliant, anything lower non compliant.
     */
    public static ComplianceLevel classify(double score) {
        if (score >= COMPLIANT_THRESHOLD) return COMPLIANT;
        if (score >= PARTIAL_THRESHOLD) return PARTIALLY_COMPLIANT;
        return NON_COMPLIANT;
    }
}
