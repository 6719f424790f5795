package com.example.compliance.service;

import com.example.compliance.Fixtures;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.TestCase;
import com.example.compliance.model.TraceabilityLink;
import com.example.compliance.model.TraceabilityMatrix;
import com.example.compliance.model.TraceabilityMatrix.CoverageAnalysis;
import com.example.compliance.model.TraceabilityMatrix.RequirementRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TraceabilityAnalyzerTest {

    private final TraceabilityAnalyzer analyzer = new TraceabilityAnalyzer();

    private static TraceabilityLink link(long id, String sourceType, long sourceId, String targetType, long targetId) {
        return new TraceabilityLink(id, sourceType, sourceId, targetType, targetId, "covers", null);
    }

    @Test
    void linksInEitherDirectionCountAsCoverage() {
        List<Requirement> requirements = List.of(
                Fixtures.requirement(1L, "REQ-1", "Login", ""),
                Fixtures.requirement(2L, "REQ-2", "Logout", ""));
        List<TestCase> testCases = List.of(
                Fixtures.completeTestCase(11L, "TC-11", "Login ok", "", List.of("step"), null),
                Fixtures.completeTestCase(12L, "TC-12", "Login fails", "", List.of("step"), null),
                Fixtures.completeTestCase(13L, "TC-13", "Crash", "", List.of("step"), null));
        List<TraceabilityLink> links = List.of(
                link(1, TraceabilityLink.REQUIREMENT, 1, TraceabilityLink.TEST_CASE, 11),
                link(2, TraceabilityLink.TEST_CASE, 12, TraceabilityLink.REQUIREMENT, 1),
                link(3, TraceabilityLink.TEST_CASE, 13, "defect", 500),
                link(4, TraceabilityLink.REQUIREMENT, 2, TraceabilityLink.TEST_CASE, 999));

        TraceabilityMatrix matrix = analyzer.analyze(requirements, testCases, links);
        CoverageAnalysis analysis = matrix.coverageAnalysis();

        assertThat(analysis.totalRequirements()).isEqualTo(2);
        assertThat(analysis.requirementsWithTests()).isEqualTo(1);
        assertThat(analysis.requirementsCoveragePercentage()).isEqualTo(50.0);
        assertThat(analysis.totalTestCases()).isEqualTo(3);
        assertThat(analysis.testCasesWithRequirements()).isEqualTo(2);
        assertThat(analysis.testCasesCoveragePercentage()).isCloseTo(66.67, within(0.01));
        assertThat(analysis.orphanedRequirements()).isEqualTo(1);
        assertThat(analysis.orphanedTestCases()).isEqualTo(1);

        assertThat(matrix.links()).hasSize(4);
        assertThat(matrix.requirements()).extracting(RequirementRow::requirementId)
                .containsExactly("REQ-1", "REQ-2");
        assertThat(matrix.testCases()).hasSize(3);
    }

    @Test
    void emptyBatchHasZeroPercentages() {
        CoverageAnalysis analysis = analyzer.analyze(List.of(), List.of(), List.of()).coverageAnalysis();

        assertThat(analysis.requirementsCoveragePercentage()).isZero();
        assertThat(analysis.testCasesCoveragePercentage()).isZero();
        assertThat(analysis.orphanedRequirements()).isZero();
        assertThat(analysis.orphanedTestCases()).isZero();
    }

    @Test
    void duplicateLinksCountOnce() {
        List<TraceabilityLink> links = List.of(
                link(1, TraceabilityLink.REQUIREMENT, 1, TraceabilityLink.TEST_CASE, 11),
                link(2, TraceabilityLink.REQUIREMENT, 1, TraceabilityLink.TEST_CASE, 11));

        CoverageAnalysis analysis = analyzer.analyze(
                List.of(Fixtures.requirement(1L, "REQ-1", "Login", "")),
                List.of(Fixtures.completeTestCase(11L, "TC-11", "Login ok", "", List.of("step"), null)),
                links).coverageAnalysis();

        assertThat(analysis.requirementsWithTests()).isEqualTo(1);
        assertThat(analysis.requirementsCoveragePercentage()).isEqualTo(100.0);
        assertThat(analysis.orphanedTestCases()).isZero();
    }
}
