package com.example.compliance.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CriteriaCheckerTest {

    private final CriteriaChecker checker = new CriteriaChecker();

    @Test
    @DisplayName("no criteria is vacuously satisfied")
    void emptyCriteriaScoreOne() {
        assertThat(checker.satisfactionRatio("anything", Map.of())).isEqualTo(1.0);
        assertThat(checker.satisfactionRatio("", Map.of())).isEqualTo(1.0);
    }

    @Test
    void ratioOfSatisfiedRequiredCriteria() {
        Map<String, Boolean> criteria = Map.of(
                "requires_traceability", true,
                "requires_verification", true);

        assertThat(checker.satisfactionRatio("full traceability to inputs", criteria)).isEqualTo(0.5);
        assertThat(checker.satisfactionRatio("trace and verify", criteria)).isEqualTo(1.0);
        assertThat(checker.satisfactionRatio("nothing relevant", criteria)).isEqualTo(0.0);
    }

    @Test
    void criteriaNotRequiredAreIgnored() {
        Map<String, Boolean> criteria = new LinkedHashMap<>();
        criteria.put("requires_traceability", true);
        criteria.put("requires_verification", false);

        assertThat(checker.satisfactionRatio("trace links", criteria)).isEqualTo(1.0);
    }

    @Test
    void unmappedCriteriaDoNotPenalize() {
        Map<String, Boolean> criteria = Map.of(
                "requires_traceability", true,
                "requires_classification", true);

        assertThat(checker.isKnown("requires_classification")).isFalse();
        assertThat(checker.satisfactionRatio("traceability matrix", criteria)).isEqualTo(1.0);
        assertThat(checker.satisfactionRatio("safety class b", Map.of("requires_classification", true)))
                .isEqualTo(1.0);
    }

    @Test
    void keywordAlternativesAreAccepted() {
        assertThat(checker.satisfactionRatio("hazard list", Map.of("requires_risk_analysis", true))).isEqualTo(1.0);
        assertThat(checker.satisfactionRatio("secure channel", Map.of("requires_security_testing", true)))
                .isEqualTo(1.0);
        assertThat(checker.satisfactionRatio("keep a record", Map.of("requires_documentation", true)))
                .isEqualTo(1.0);
        assertThat(checker.satisfactionRatio("validate inputs", Map.of("requires_validation", true)))
                .isEqualTo(1.0);
    }
}
