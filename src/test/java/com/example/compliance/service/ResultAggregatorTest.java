package com.example.compliance.service;

import com.example.compliance.Fixtures;
import com.example.compliance.model.ComplianceLevel;
import com.example.compliance.model.ComplianceResult;
import com.example.compliance.model.RiskLevel;
import com.example.compliance.model.StandardCompliance;
import com.example.compliance.rules.RuleCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = Fixtures.resultAggregator(new RuleCatalog());

    private static ComplianceResult result(String standard, double score) {
        return new ComplianceResult("RULE", standard, ComplianceLevel.classify(score), score,
                List.of(), List.of(), List.of(), RiskLevel.HIGH);
    }

    @Test
    void requirementIsAssessedAgainstEveryMatchingRuleInCatalogOrder() {
        List<ComplianceResult> results = aggregator.assessRequirement(
                Fixtures.requirement(1L, "REQ-001", "Patient data risk controls", Fixtures.FDA_DESIGN_TEXT));

        assertThat(results).extracting(ComplianceResult::ruleId)
                .containsExactly("FDA_820_001", "FDA_820_002", "HIPAA_001");
        assertThat(results).allMatch(ComplianceResult::isKnown);
    }

    @Test
    void emptyRequirementProducesNoResults() {
        assertThat(aggregator.assessRequirement(Fixtures.requirement(2L, "REQ-002", "", ""))).isEmpty();
    }

    @Test
    void testCaseIsAssessedWithRelatedRequirement() {
        List<ComplianceResult> results = aggregator.assessTestCase(
                Fixtures.accessControlTestCase(), Fixtures.accessControlRequirement());

        assertThat(results).extracting(ComplianceResult::ruleId).containsExactly("ISO_27001_001");
        assertThat(results.get(0).score()).isEqualTo(0.72);
    }

    @Test
    void rollupAveragesEachGroupThenBothGroups() {
        List<ComplianceResult> requirementResults = List.of(
                result(RuleCatalog.HIPAA, 0.9), result(RuleCatalog.HIPAA, 0.7), result(RuleCatalog.GDPR, 0.1));
        List<ComplianceResult> testCaseResults = List.of(result(RuleCatalog.HIPAA, 0.4));

        Optional<StandardCompliance> rollup = aggregator.rollup(RuleCatalog.HIPAA, requirementResults, testCaseResults);

        assertThat(rollup).isPresent();
        assertThat(rollup.get().score()).isEqualTo(0.6);
        assertThat(rollup.get().complianceLevel()).isEqualTo(ComplianceLevel.PARTIALLY_COMPLIANT);
        assertThat(rollup.get().requirementCount()).isEqualTo(2);
        assertThat(rollup.get().testCaseCount()).isEqualTo(1);
    }

    @Test
    void rollupWithOnlyOneGroupUsesThatGroup() {
        StandardCompliance requirementsOnly = aggregator
                .rollup(RuleCatalog.GDPR, List.of(result(RuleCatalog.GDPR, 0.9)), List.of())
                .orElseThrow();
        StandardCompliance testCasesOnly = aggregator
                .rollup(RuleCatalog.GDPR, List.of(), List.of(result(RuleCatalog.GDPR, 0.3)))
                .orElseThrow();

        assertThat(requirementsOnly.score()).isEqualTo(0.9);
        assertThat(requirementsOnly.complianceLevel()).isEqualTo(ComplianceLevel.COMPLIANT);
        assertThat(testCasesOnly.score()).isEqualTo(0.3);
        assertThat(testCasesOnly.complianceLevel()).isEqualTo(ComplianceLevel.NON_COMPLIANT);
    }

    @Test
    void standardWithoutResultsHasNoRollup() {
        assertThat(aggregator.rollup(RuleCatalog.ISO_9001,
                List.of(result(RuleCatalog.HIPAA, 0.5)), List.of())).isEmpty();
    }

    @Test
    void overallComplianceFollowsCatalogOrderAndSkipsEmptyStandards() {
        Map<String, StandardCompliance> overall = aggregator.overallCompliance(
                List.of(result(RuleCatalog.GDPR, 0.6), result(RuleCatalog.FDA_820, 0.8)),
                List.of(result(RuleCatalog.GDPR, 0.2)));

        assertThat(overall.keySet()).containsExactly(RuleCatalog.FDA_820, RuleCatalog.GDPR);
        assertThat(overall.get(RuleCatalog.GDPR).score()).isEqualTo(0.4);
    }
}
