package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReportSummary(
        int totalRequirements,
        int totalTestCases,
        List<String> standardsAssessed
) {
    public ReportSummary {
        standardsAssessed = standardsAssessed != null ? List.copyOf(standardsAssessed) : List.of();
    }
}
