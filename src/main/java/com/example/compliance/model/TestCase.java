package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied snapshot of a test case.
 *
 * @param id              Internal identifier
 * @param testCaseId      Public identifier (e.g. TC-001)
 * @param title           Test case title
 * @param description     What the test case verifies
 * @param preconditions   State required before execution
 * @param testSteps       Ordered steps
 * @param expectedResults Expected outcome
 * @param postconditions  State after execution
 * @param priority        high, medium, low
 * @param testData        Free-form test data
 * @param complianceTags  Standards the test case is tagged with
 * @param requirementId   {@link Requirement#id()} of the verified requirement, if any
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonDeserialize(using = TestCaseDeserializer.class)
public record TestCase(
        Long id,
        String testCaseId,
        String title,
        String description,
        String preconditions,
        List<String> testSteps,
        String expectedResults,
        String postconditions,
        String priority,
        Map<String, Object> testData,
        List<String> complianceTags,
        Long requirementId
) {
    public TestCase {
        testCaseId = testCaseId != null ? testCaseId : "";
        title = title != null ? title : "";
        description = description != null ? description : "";
        preconditions = preconditions != null ? preconditions : "";
        testSteps = testSteps != null ? testSteps.stream().filter(Objects::nonNull).toList() : List.of();
        expectedResults = expectedResults != null ? expectedResults : "";
        postconditions = postconditions != null ? postconditions : "";
        priority = priority != null ? priority : "";
        testData = testData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(testData)) : Map.of();
        complianceTags = complianceTags != null ? complianceTags.stream().filter(Objects::nonNull).toList() : List.of();
    }

    /** Title, description and all test steps, lower-cased. */
    public String searchableText() {
        String header = (title + " " + description).toLowerCase(Locale.ROOT);
        String steps = String.join(" ", testSteps).toLowerCase(Locale.ROOT);
        return header + " " + steps;
    }

    /** Identifier shown in reports. */
    public String displayId() {
        return testCaseId.isEmpty() ? "Unknown" : testCaseId;
    }
}
