package com.example.compliance.service;

import com.example.compliance.model.ComplianceLevel;
import com.example.compliance.model.ComplianceResult;
import com.example.compliance.model.ComplianceRule;
import com.example.compliance.model.PatternMatch;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a single entity against a single rule.
 * <p>
 * Requirements: {@code 0.6 * patternRatio + 0.4 * criteriaRatio}.
 * <br>
 * Test cases: {@code 0.7 * patternRatio}, plus {@code 0.3} when the linked requirement
 * matches the rule, averaged with the structural completeness of the test case.
 * <p>
 * A rule with no evidence yields an {@link ComplianceLevel#UNKNOWN} result, which callers drop.
 */
@Service
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    static final double REQUIREMENT_PATTERN_WEIGHT = 0.6;
    static final double REQUIREMENT_CRITERIA_WEIGHT = 0.4;
    static final double TEST_CASE_PATTERN_WEIGHT = 0.7;
    static final double LINKED_REQUIREMENT_BONUS = 0.3;

    /** Pattern ratio used for rules that define no test case patterns. */
    static final double DEFAULT_TEST_CASE_PATTERN_SCORE = 0.5;

    /** Scores are kept to four decimal places. */
    private static final double SCORE_SCALE = 10_000d;

    private final PatternMatcher patternMatcher;
    private final CriteriaChecker criteriaChecker;
    private final CompletenessScorer completenessScorer;

    public ScoringEngine(PatternMatcher patternMatcher,
                         CriteriaChecker criteriaChecker,
                         CompletenessScorer completenessScorer) {
        this.patternMatcher = patternMatcher;
        this.criteriaChecker = criteriaChecker;
        this.completenessScorer = completenessScorer;
    }

    /**
     * Evaluates a requirement against a rule.
     *
     * @param requirementText lower-cased title and description
     * @param requirement     the requirement snapshot
     * @param rule            the rule to apply
     * @return the graded result, UNKNOWN when no requirement pattern matched
     */
    public ComplianceResult evaluateRequirement(String requirementText, Requirement requirement,
                                                ComplianceRule rule) {
        PatternMatch match = patternMatcher.match(requirementText, rule.requirementPatterns());
        if (match.isEmpty()) {
            return ComplianceResult.unknown(rule);
        }

        List<String> evidence = match.matchedPatterns().stream()
                .map(p -> "Found pattern: " + p)
                .toList();

        double patternScore = Math.min((double) match.count() / rule.requirementPatterns().size(), 1.0);
        double criteriaScore = criteriaChecker.satisfactionRatio(
                requirement.searchableText(), rule.validationCriteria());
        double score = roundScore(REQUIREMENT_PATTERN_WEIGHT * patternScore
                + REQUIREMENT_CRITERIA_WEIGHT * criteriaScore);

        ComplianceLevel level = ComplianceLevel.classify(score);
        List<String> findings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (level == ComplianceLevel.PARTIALLY_COMPLIANT) {
            findings.add("Requirement partially meets compliance criteria");
            recommendations.add("Enhance requirement to fully comply with " + rule.standard());
        } else if (level == ComplianceLevel.NON_COMPLIANT) {
            findings.add("Requirement does not meet compliance criteria");
            recommendations.add("Revise requirement to comply with " + rule.standard());
        }

        if (rule.requires("requires_traceability") && !requirementText.contains("traceability")) {
            recommendations.add("Add traceability requirements");
        }
        if (rule.requires("requires_risk_analysis") && !requirementText.contains("risk")) {
            recommendations.add("Include risk analysis requirements");
        }

        log.debug("ScoringEngine: requirement '{}' vs {} → {} ({} patterns, criteria {})",
                requirement.displayId(), rule.ruleId(), score, match.count(), criteriaScore);

        return new ComplianceResult(rule.ruleId(), rule.standard(), level, score,
                findings, recommendations, evidence, rule.riskLevel());
    }

    /**
     * Evaluates a test case against a rule.
     *
     * @param testCaseText lower-cased title, description and test steps
     * @param testCase     the test case snapshot
     * @param rule         the rule to apply
     * @param related      the requirement the test case verifies, or {@code null}
     * @return the graded result, UNKNOWN when neither the test case nor the related requirement matched
     */
    public ComplianceResult evaluateTestCase(String testCaseText, TestCase testCase,
                                             ComplianceRule rule, Requirement related) {
        PatternMatch match = patternMatcher.match(testCaseText, rule.testCasePatterns());
        int requirementMatches = related != null
                ? patternMatcher.countMatches(related.searchableText(), rule.requirementPatterns())
                : 0;

        if (match.isEmpty() && requirementMatches == 0) {
            return ComplianceResult.unknown(rule);
        }

        List<String> evidence = new ArrayList<>();
        match.matchedPatterns().forEach(p -> evidence.add("Found test pattern: " + p));

        double patternScore = rule.testCasePatterns().isEmpty()
                ? DEFAULT_TEST_CASE_PATTERN_SCORE
                : Math.min((double) match.count() / rule.testCasePatterns().size(), 1.0);

        double score = TEST_CASE_PATTERN_WEIGHT * patternScore;
        if (requirementMatches > 0) {
            score += LINKED_REQUIREMENT_BONUS;
            evidence.add("Test case addresses compliance-related requirements");
        }

        double completeness = completenessScorer.score(testCase);
        score = roundScore((score + completeness) / 2);

        ComplianceLevel level = ComplianceLevel.classify(score);
        List<String> findings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (level == ComplianceLevel.PARTIALLY_COMPLIANT) {
            findings.add("Test case partially covers compliance requirements");
            recommendations.add("Enhance test case to fully verify " + rule.standard() + " compliance");
        } else if (level == ComplianceLevel.NON_COMPLIANT) {
            findings.add("Test case does not adequately verify compliance");
            recommendations.add("Add test steps to verify " + rule.standard() + " compliance");
        }

        if (rule.requires("requires_security_testing") && !testCaseText.contains("security")) {
            recommendations.add("Add security testing steps");
        }
        if (rule.requires("requires_verification") && !testCaseText.contains("verify")) {
            recommendations.add("Add verification steps");
        }

        log.debug("ScoringEngine: test case '{}' vs {} → {} ({} patterns, {} requirement patterns, completeness {})",
                testCase.displayId(), rule.ruleId(), score, match.count(), requirementMatches, completeness);

        return new ComplianceResult(rule.ruleId(), rule.standard(), level, score,
                findings, recommendations, evidence, rule.riskLevel());
    }

    /**
     * Rounds half-up to four decimals and clamps to [0,1].
     */
    public static double roundScore(double score) {
        double rounded = Math.round(score * SCORE_SCALE) / SCORE_SCALE;
        return Math.max(0.0, Math.min(1.0, rounded));
    }
}
