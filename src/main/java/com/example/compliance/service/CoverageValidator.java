package com.example.compliance.service;

import com.example.compliance.model.ComplianceLevel;
import com.example.compliance.model.ComplianceResult;
import com.example.compliance.model.CoverageGap;
import com.example.compliance.model.CoverageReport;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks that requirements are verified by test cases that actually satisfy the applicable rules.
 * <p>
 * A gap is reported for every requirement without linked test cases and for every linked test case
 * result that is only partially compliant or non compliant.
 */
@Service
public class CoverageValidator {

    private static final Logger log = LoggerFactory.getLogger(CoverageValidator.class);

    static final List<String> GAP_RECOMMENDATIONS = List.of(
            "Review and enhance test cases for requirements with compliance gaps",
            "Ensure all regulatory requirements have adequate test coverage",
            "Consider adding specific compliance verification steps to test cases");

    static final List<String> NO_GAP_RECOMMENDATIONS = List.of(
            "Test coverage appears adequate for compliance requirements",
            "Continue monitoring and updating test cases as requirements evolve");

    private final ResultAggregator resultAggregator;

    public CoverageValidator(ResultAggregator resultAggregator) {
        this.resultAggregator = resultAggregator;
    }

    /**
     * @param standard     standard to narrow the validation to; {@code null} or blank for all
     * @param requirements requirement snapshots
     * @param testCases    test case snapshots, linked through {@code requirement_id}
     * @return gaps and closing recommendations
     */
    public CoverageReport validate(String standard, List<Requirement> requirements, List<TestCase> testCases) {
        boolean narrowed = standard != null && !standard.isBlank();
        List<CoverageGap> gaps = new ArrayList<>();

        for (Requirement requirement : requirements) {
            if (narrowed && !requirement.regulatoryStandards().contains(standard)) continue;

            List<TestCase> linked = testCases.stream()
                    .filter(tc -> requirement.id() != null && Objects.equals(tc.requirementId(), requirement.id()))
                    .toList();

            if (linked.isEmpty()) {
                gaps.add(CoverageGap.untested(requirement));
                continue;
            }

            for (TestCase testCase : linked) {
                for (ComplianceResult result : resultAggregator.assessTestCase(testCase, requirement)) {
                    if (narrowed && !standard.equals(result.standard())) continue;
                    if (result.complianceLevel() == ComplianceLevel.NON_COMPLIANT
                            || result.complianceLevel() == ComplianceLevel.PARTIALLY_COMPLIANT) {
                        gaps.add(new CoverageGap(requirement.displayId(), null, testCase.displayId(),
                                result.standard(), result.complianceLevel(),
                                String.join(", ", result.findings()),
                                String.join(", ", result.recommendations())));
                    }
                }
            }
        }

        log.info("CoverageValidator: {} gaps found for standard '{}'", gaps.size(), narrowed ? standard : "all");

        return new CoverageReport(narrowed ? standard : null, requirements.size(), testCases.size(), gaps,
                gaps.isEmpty() ? NO_GAP_RECOMMENDATIONS : GAP_RECOMMENDATIONS);
    }
}
