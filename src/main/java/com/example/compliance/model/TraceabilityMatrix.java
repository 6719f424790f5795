package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Requirements, test cases and the links between them, with coverage statistics.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TraceabilityMatrix(
        List<RequirementRow> requirements,
        List<TestCaseRow> testCases,
        List<TraceabilityLink> links,
        CoverageAnalysis coverageAnalysis
) {
    public TraceabilityMatrix {
        requirements = requirements != null ? List.copyOf(requirements) : List.of();
        testCases = testCases != null ? List.copyOf(testCases) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RequirementRow(
            Long id,
            String requirementId,
            String title,
            String type,
            String priority,
            List<String> regulatoryStandards
    ) {
        public static RequirementRow of(Requirement requirement) {
            return new RequirementRow(requirement.id(), requirement.requirementId(), requirement.title(),
                    requirement.type(), requirement.priority(), requirement.regulatoryStandards());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TestCaseRow(
            Long id,
            String testCaseId,
            String title,
            String priority,
            Long requirementId,
            List<String> complianceTags
    ) {
        public static TestCaseRow of(TestCase testCase) {
            return new TestCaseRow(testCase.id(), testCase.testCaseId(), testCase.title(),
                    testCase.priority(), testCase.requirementId(), testCase.complianceTags());
        }
    }

    /**
     * Link-based coverage figures. Percentages are 0 when the corresponding total is 0.
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CoverageAnalysis(
            int totalRequirements,
            int requirementsWithTests,
            double requirementsCoveragePercentage,
            int totalTestCases,
            int testCasesWithRequirements,
            double testCasesCoveragePercentage,
            int orphanedRequirements,
            int orphanedTestCases
    ) {}
}
