package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Batch-level rollup for one standard.
 *
 * @param score            Mean of the requirement and test case averages (or the only non-empty one)
 * @param complianceLevel  Verdict for {@code score}
 * @param requirementCount Requirement results that contributed
 * @param testCaseCount    Test case results that contributed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StandardCompliance(
        double score,
        ComplianceLevel complianceLevel,
        int requirementCount,
        int testCaseCount
) {}
