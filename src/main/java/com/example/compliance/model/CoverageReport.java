package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Result of a test coverage validation.
 *
 * @param standard         Standard the validation was narrowed to, null for all
 * @param totalRequirements Requirements supplied
 * @param totalTestCases   Test cases supplied
 * @param coverageGaps     Detected gaps
 * @param recommendations  Closing advice
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CoverageReport(
        String standard,
        int totalRequirements,
        int totalTestCases,
        List<CoverageGap> coverageGaps,
        List<String> recommendations
) {
    public CoverageReport {
        coverageGaps = coverageGaps != null ? List.copyOf(coverageGaps) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
