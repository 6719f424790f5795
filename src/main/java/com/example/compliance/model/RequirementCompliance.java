package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collection;
import java.util.List;

/**
 * Report section for a single requirement.
 *
 * @param requirementId     Public requirement identifier
 * @param complianceResults Non-UNKNOWN results, in catalog order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RequirementCompliance(
        String requirementId,
        List<ComplianceResult> complianceResults
) {
    public RequirementCompliance {
        complianceResults = complianceResults != null ? List.copyOf(complianceResults) : List.of();
    }

    public RequirementCompliance restrictTo(Collection<String> standards) {
        return new RequirementCompliance(requirementId, complianceResults.stream()
                .filter(r -> standards.contains(r.standard()))
                .toList());
    }
}
