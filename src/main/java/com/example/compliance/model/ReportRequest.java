package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param standards optional post-hoc filter; empty keeps every standard
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReportRequest(
        List<Requirement> requirements,
        List<TestCase> testCases,
        List<String> standards
) {
    public ReportRequest {
        requirements = JsonFields.nonNullElements(requirements);
        testCases = JsonFields.nonNullElements(testCases);
        standards = JsonFields.nonNullElements(standards);
    }
}
