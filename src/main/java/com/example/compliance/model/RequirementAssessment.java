package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RequirementAssessment(
        String requirementId,
        List<ComplianceResult> complianceResults,
        int totalAssessments
) {
    public static RequirementAssessment of(Requirement requirement, List<ComplianceResult> results) {
        return new RequirementAssessment(requirement.displayId(), List.copyOf(results), results.size());
    }
}
