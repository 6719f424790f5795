package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param relatedRequirement public id of the requirement used for the bonus, null when none was supplied
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestCaseAssessment(
        String testCaseId,
        List<ComplianceResult> complianceResults,
        int totalAssessments,
        String relatedRequirement
) {
    public static TestCaseAssessment of(TestCase testCase, Requirement related, List<ComplianceResult> results) {
        return new TestCaseAssessment(testCase.displayId(), List.copyOf(results), results.size(),
                related != null ? related.displayId() : null);
    }
}
