package com.example.compliance.service;

import com.example.compliance.model.ComplianceLevel;
import com.example.compliance.model.ComplianceResult;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.StandardCompliance;
import com.example.compliance.model.TestCase;
import com.example.compliance.rules.RuleCatalog;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every catalog rule over an entity and rolls results up per standard.
 * Results with {@link ComplianceLevel#UNKNOWN} never leave this class.
 */
@Service
public class ResultAggregator {

    private final RuleCatalog ruleCatalog;
    private final ScoringEngine scoringEngine;

    public ResultAggregator(RuleCatalog ruleCatalog, ScoringEngine scoringEngine) {
        this.ruleCatalog = ruleCatalog;
        this.scoringEngine = scoringEngine;
    }

    public List<ComplianceResult> assessRequirement(Requirement requirement) {
        String text = requirement.searchableText();
        return ruleCatalog.allRules().stream()
                .map(rule -> scoringEngine.evaluateRequirement(text, requirement, rule))
                .filter(ComplianceResult::isKnown)
                .toList();
    }

    /**
     * @param testCase the test case snapshot
     * @param related  the requirement it verifies, or {@code null}
     */
    public List<ComplianceResult> assessTestCase(TestCase testCase, Requirement related) {
        String text = testCase.searchableText();
        return ruleCatalog.allRules().stream()
                .map(rule -> scoringEngine.evaluateTestCase(text, testCase, rule, related))
                .filter(ComplianceResult::isKnown)
                .toList();
    }

    /**
     * Rolls the results of one standard up into a single score.
     * <p>
     * Each group is averaged on its own; when both groups have results the overall score is the
     * mean of the two averages, otherwise it is the average of the non-empty group.
     *
     * @param standard           standard label
     * @param requirementResults requirement results (any standard, filtered here)
     * @param testCaseResults    test case results (any standard, filtered here)
     * @return the rollup, empty when the standard has no results at all
     */
    public Optional<StandardCompliance> rollup(String standard,
                                               List<ComplianceResult> requirementResults,
                                               List<ComplianceResult> testCaseResults) {
        List<ComplianceResult> requirements = ofStandard(standard, requirementResults);
        List<ComplianceResult> testCases = ofStandard(standard, testCaseResults);

        if (requirements.isEmpty() && testCases.isEmpty()) {
            return Optional.empty();
        }

        double score;
        if (!requirements.isEmpty() && !testCases.isEmpty()) {
            score = (average(requirements) + average(testCases)) / 2;
        } else if (!requirements.isEmpty()) {
            score = average(requirements);
        } else {
            score = average(testCases);
        }
        score = ScoringEngine.roundScore(score);

        return Optional.of(new StandardCompliance(score, ComplianceLevel.classify(score),
                requirements.size(), testCases.size()));
    }

    /**
     * Rollup for every supported standard that has at least one result, in catalog order.
     */
    public Map<String, StandardCompliance> overallCompliance(List<ComplianceResult> requirementResults,
                                                             List<ComplianceResult> testCaseResults) {
        Map<String, StandardCompliance> overall = new LinkedHashMap<>();
        for (String standard : ruleCatalog.standards()) {
            rollup(standard, requirementResults, testCaseResults)
                    .ifPresent(rollup -> overall.put(standard, rollup));
        }
        return overall;
    }

    private static List<ComplianceResult> ofStandard(String standard, List<ComplianceResult> results) {
        return results.stream()
                .filter(r -> standard.equals(r.standard()))
                .toList();
    }

    private static double average(List<ComplianceResult> results) {
        return results.stream().mapToDouble(ComplianceResult::score).average().orElse(0.0);
    }
}
