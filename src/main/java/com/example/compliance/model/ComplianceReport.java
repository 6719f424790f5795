package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-standard compliance report over a batch of requirements and test cases.
 *
 * @param generatedAt           Creation timestamp
 * @param summary               Batch counts and the standards assessed
 * @param requirementCompliance One section per requirement
 * @param testCaseCompliance    One section per test case
 * @param overallCompliance     Standard label → rollup; standards without results are absent
 * @param recommendations       Most frequent recommendations, rendered with their counts
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComplianceReport(
        LocalDateTime generatedAt,
        ReportSummary summary,
        List<RequirementCompliance> requirementCompliance,
        List<TestCaseCompliance> testCaseCompliance,
        Map<String, StandardCompliance> overallCompliance,
        List<String> recommendations
) {
    public ComplianceReport {
        requirementCompliance = requirementCompliance != null ? List.copyOf(requirementCompliance) : List.of();
        testCaseCompliance = testCaseCompliance != null ? List.copyOf(testCaseCompliance) : List.of();
        overallCompliance = overallCompliance != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(overallCompliance))
                : Map.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    /**
     * Returns a copy of this report limited to the given standards.
     * Sections left without results are dropped; summary, timestamp and recommendations are kept as is.
     * No scoring is re-run.
     *
     * @param standards standard labels to keep
     * @return the filtered report
     */
    public ComplianceReport restrictTo(Collection<String> standards) {
        Set<String> wanted = Set.copyOf(standards);

        List<RequirementCompliance> requirements = requirementCompliance.stream()
                .map(section -> section.restrictTo(wanted))
                .filter(section -> !section.complianceResults().isEmpty())
                .toList();

        List<TestCaseCompliance> testCases = testCaseCompliance.stream()
                .map(section -> section.restrictTo(wanted))
                .filter(section -> !section.complianceResults().isEmpty())
                .toList();

        Map<String, StandardCompliance> overall = new LinkedHashMap<>();
        overallCompliance.forEach((standard, rollup) -> {
            if (wanted.contains(standard)) overall.put(standard, rollup);
        });

        return new ComplianceReport(generatedAt, summary, requirements, testCases, overall, recommendations);
    }
}
