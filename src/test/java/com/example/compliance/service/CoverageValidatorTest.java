package com.example.compliance.service;

import com.example.compliance.Fixtures;
import com.example.compliance.model.ComplianceLevel;
import com.example.compliance.model.CoverageGap;
import com.example.compliance.model.CoverageReport;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.TestCase;
import com.example.compliance.rules.RuleCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CoverageValidatorTest {

    private final CoverageValidator validator = new CoverageValidator(Fixtures.resultAggregator(new RuleCatalog()));

    @Test
    void requirementWithoutTestCasesIsAGap() {
        Requirement requirement = Fixtures.requirement(5L, "REQ-005", "Audit trail", "All access is logged.");

        CoverageReport report = validator.validate(null, List.of(requirement), List.of());

        assertThat(report.coverageGaps()).containsExactly(
                new CoverageGap("REQ-005", "Audit trail", null, null, null,
                        "No test cases found", "Create test cases to verify this requirement"));
        assertThat(report.recommendations()).isEqualTo(CoverageValidator.GAP_RECOMMENDATIONS);
        assertThat(report.standard()).isNull();
    }

    @Test
    void partiallyCompliantLinkedTestCaseIsAGap() {
        CoverageReport report = validator.validate(null,
                List.of(Fixtures.accessControlRequirement()), List.of(Fixtures.accessControlTestCase()));

        assertThat(report.coverageGaps()).hasSize(1);
        CoverageGap gap = report.coverageGaps().get(0);
        assertThat(gap.requirementId()).isEqualTo("REQ-010");
        assertThat(gap.testCaseId()).isEqualTo("TC-020");
        assertThat(gap.standard()).isEqualTo(RuleCatalog.ISO_27001);
        assertThat(gap.complianceLevel()).isEqualTo(ComplianceLevel.PARTIALLY_COMPLIANT);
        assertThat(gap.issue()).isEqualTo("Test case partially covers compliance requirements");
        assertThat(gap.recommendation())
                .isEqualTo("Enhance test case to fully verify ISO 27001 compliance, Add security testing steps");
        assertThat(report.totalRequirements()).isEqualTo(1);
        assertThat(report.totalTestCases()).isEqualTo(1);
    }

    @Test
    void compliantLinkedTestCaseLeavesNoGap() {
        TestCase thorough = Fixtures.completeTestCase(21L, "TC-021", "Security verification", "Security suite",
                List.of("Run security test", "Run penetration test", "Run encryption test"), 10L);

        CoverageReport report = validator.validate(null,
                List.of(Fixtures.accessControlRequirement()), List.of(thorough));

        assertThat(report.coverageGaps()).isEmpty();
        assertThat(report.recommendations()).isEqualTo(CoverageValidator.NO_GAP_RECOMMENDATIONS);
    }

    @Test
    void narrowingSkipsRequirementsOfOtherStandards() {
        Requirement untagged = Fixtures.requirement(6L, "REQ-006", "Consent", "Collect consent.");

        CoverageReport hipaa = validator.validate(RuleCatalog.HIPAA,
                List.of(Fixtures.accessControlRequirement(), untagged), List.of(Fixtures.accessControlTestCase()));
        CoverageReport iso = validator.validate(RuleCatalog.ISO_27001,
                List.of(Fixtures.accessControlRequirement(), untagged), List.of(Fixtures.accessControlTestCase()));

        assertThat(hipaa.standard()).isEqualTo(RuleCatalog.HIPAA);
        assertThat(hipaa.coverageGaps()).isEmpty();
        assertThat(iso.coverageGaps()).extracting(CoverageGap::testCaseId).containsExactly("TC-020");
        assertThat(iso.totalRequirements()).isEqualTo(2);
    }

    @Test
    void blankStandardMeansAllStandards() {
        CoverageReport report = validator.validate("  ",
                List.of(Fixtures.requirement(7L, "REQ-007", "Anything", "")), List.of());

        assertThat(report.standard()).isNull();
        assertThat(report.coverageGaps()).hasSize(1);
    }
}
