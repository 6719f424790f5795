package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collection;
import java.util.List;

/**
 * Report section for a single test case.
 *
 * @param testCaseId        Public test case identifier
 * @param complianceResults Non-UNKNOWN results, in catalog order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestCaseCompliance(
        String testCaseId,
        List<ComplianceResult> complianceResults
) {
    public TestCaseCompliance {
        complianceResults = complianceResults != null ? List.copyOf(complianceResults) : List.of();
    }

    public TestCaseCompliance restrictTo(Collection<String> standards) {
        return new TestCaseCompliance(testCaseId, complianceResults.stream()
                .filter(r -> standards.contains(r.standard()))
                .toList());
    }
}
