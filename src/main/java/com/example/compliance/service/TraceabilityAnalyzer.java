package com.example.compliance.service;

import com.example.compliance.model.Requirement;
import com.example.compliance.model.TestCase;
import com.example.compliance.model.TraceabilityLink;
import com.example.compliance.model.TraceabilityMatrix;
import com.example.compliance.model.TraceabilityMatrix.CoverageAnalysis;
import com.example.compliance.model.TraceabilityMatrix.RequirementRow;
import com.example.compliance.model.TraceabilityMatrix.TestCaseRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.compliance.model.TraceabilityLink.REQUIREMENT;
import static com.example.compliance.model.TraceabilityLink.TEST_CASE;

/**
 * Builds the requirement ↔ test case traceability matrix from explicit links.
 * <p>
 * A link in either direction between a requirement and a test case marks both ends as covered.
 * Links to other artifact types (e.g. defects) or to artifacts missing from the batch are listed
 * but do not affect coverage.
 */
@Service
public class TraceabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TraceabilityAnalyzer.class);

    public TraceabilityMatrix analyze(List<Requirement> requirements, List<TestCase> testCases,
                                      List<TraceabilityLink> links) {
        Set<Long> knownRequirements = requirements.stream()
                .map(Requirement::id)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<Long> knownTestCases = testCases.stream()
                .map(TestCase::id)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        Set<Long> requirementsWithTests = new HashSet<>();
        Set<Long> testCasesWithRequirements = new HashSet<>();

        for (TraceabilityLink link : links) {
            Long requirementId;
            Long testCaseId;
            if (link.connects(REQUIREMENT, TEST_CASE)) {
                requirementId = link.sourceId();
                testCaseId = link.targetId();
            } else if (link.connects(TEST_CASE, REQUIREMENT)) {
                requirementId = link.targetId();
                testCaseId = link.sourceId();
            } else {
                continue;
            }
            // dangling links do not count as coverage
            if (knownRequirements.contains(requirementId) && knownTestCases.contains(testCaseId)) {
                requirementsWithTests.add(requirementId);
                testCasesWithRequirements.add(testCaseId);
            } else {
                log.warn("TraceabilityAnalyzer: link {} points to an unknown artifact, ignored", link.id());
            }
        }

        int totalRequirements = requirements.size();
        int totalTestCases = testCases.size();

        CoverageAnalysis analysis = new CoverageAnalysis(
                totalRequirements,
                requirementsWithTests.size(),
                percentage(requirementsWithTests.size(), totalRequirements),
                totalTestCases,
                testCasesWithRequirements.size(),
                percentage(testCasesWithRequirements.size(), totalTestCases),
                totalRequirements - requirementsWithTests.size(),
                totalTestCases - testCasesWithRequirements.size());

        log.info("TraceabilityAnalyzer: {}/{} requirements and {}/{} test cases linked",
                requirementsWithTests.size(), totalRequirements, testCasesWithRequirements.size(), totalTestCases);

        return new TraceabilityMatrix(
                requirements.stream().map(RequirementRow::of).toList(),
                testCases.stream().map(TestCaseRow::of).toList(),
                links,
                analysis);
    }

    private static double percentage(int part, int total) {
        return total > 0 ? (double) part / total * 100 : 0;
    }
}
