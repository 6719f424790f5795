package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CoverageRequest(
        String standard,
        List<Requirement> requirements,
        List<TestCase> testCases
) {
    public CoverageRequest {
        requirements = JsonFields.nonNullElements(requirements);
        testCases = JsonFields.nonNullElements(testCases);
    }
}
