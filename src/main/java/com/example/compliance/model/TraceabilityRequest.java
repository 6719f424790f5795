package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TraceabilityRequest(
        List<Requirement> requirements,
        List<TestCase> testCases,
        List<TraceabilityLink> links
) {
    public TraceabilityRequest {
        requirements = JsonFields.nonNullElements(requirements);
        testCases = JsonFields.nonNullElements(testCases);
        links = JsonFields.nonNullElements(links);
    }
}
