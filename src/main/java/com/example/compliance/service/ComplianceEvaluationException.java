package com.example.compliance.service;

/**
 * Wraps an unexpected failure while evaluating one entity of a batch.
 */
public class ComplianceEvaluationException extends RuntimeException {

    private final String entityId;

    public ComplianceEvaluationException(String entityId, Throwable cause) {
        super("Compliance evaluation failed for '" + entityId + "': " + cause.getMessage(), cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
