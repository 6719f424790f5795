package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A requirement (optionally narrowed to one of its test cases) whose verification is insufficient.
 *
 * @param requirementId   Public requirement identifier
 * @param title           Requirement title, set only for "no test cases" gaps
 * @param testCaseId      Offending test case, null when no test case exists
 * @param standard        Standard of the failing result, null when no test case exists
 * @param complianceLevel Level of the failing result, null when no test case exists
 * @param issue           What is wrong
 * @param recommendation  What to do about it
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CoverageGap(
        String requirementId,
        String title,
        String testCaseId,
        String standard,
        ComplianceLevel complianceLevel,
        String issue,
        String recommendation
) {
    public static CoverageGap untested(Requirement requirement) {
        return new CoverageGap(requirement.displayId(), requirement.title(), null, null, null,
                "No test cases found", "Create test cases to verify this requirement");
    }
}
