package com.example.compliance.service;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.ComplianceReport;
import com.example.compliance.model.ComplianceResult;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.RequirementCompliance;
import com.example.compliance.model.ReportSummary;
import com.example.compliance.model.StandardCompliance;
import com.example.compliance.model.TestCase;
import com.example.compliance.model.TestCaseCompliance;
import com.example.compliance.rules.RuleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

/**
 * Builds cross-standard compliance reports over a batch of requirements and test cases.
 * <p>
 * Pipeline:
 * 1. Parallel assessment of every requirement and test case (one task per entity)
 * 2. Per-standard rollup across the whole batch
 * 3. Frequency ranking of recommendations
 * <p>
 * Entity tasks are joined in input order, so the report does not depend on scheduling.
 */
@Service
public class ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    private final RuleCatalog ruleCatalog;
    private final ResultAggregator resultAggregator;
    private final ExecutorService evaluationExecutor;
    private final Clock clock;
    private final int recommendationLimit;

    public ReportGenerator(RuleCatalog ruleCatalog,
                           ResultAggregator resultAggregator,
                           ExecutorService evaluationExecutor,
                           Clock clock,
                           ComplianceProperties properties) {
        this.ruleCatalog = ruleCatalog;
        this.resultAggregator = resultAggregator;
        this.evaluationExecutor = evaluationExecutor;
        this.clock = clock;
        this.recommendationLimit = properties.report().recommendationLimit();
    }

    /**
     * Generates a report covering every supported standard.
     *
     * @param requirements requirement snapshots
     * @param testCases    test case snapshots; each is linked to the requirement whose {@code id}
     *                     equals its {@code requirement_id}
     * @return the report
     */
    public ComplianceReport generate(List<Requirement> requirements, List<TestCase> testCases) {
        log.info("ReportGenerator: starting report for {} requirements and {} test cases",
                requirements.size(), testCases.size());

        // ── Step 1: parallel per-entity assessment ──
        Map<Long, Requirement> requirementsById = new HashMap<>();
        for (Requirement requirement : requirements) {
            if (requirement.id() != null) requirementsById.putIfAbsent(requirement.id(), requirement);
        }

        List<CompletableFuture<RequirementCompliance>> requirementTasks = requirements.stream()
                .map(requirement -> CompletableFuture.supplyAsync(
                        () -> assessRequirement(requirement), evaluationExecutor))
                .toList();

        List<CompletableFuture<TestCaseCompliance>> testCaseTasks = testCases.stream()
                .map(testCase -> {
                    Requirement related = relatedRequirement(testCase, requirementsById);
                    return CompletableFuture.supplyAsync(
                            () -> assessTestCase(testCase, related), evaluationExecutor);
                })
                .toList();

        List<RequirementCompliance> requirementSections = requirementTasks.stream().map(ReportGenerator::await).toList();
        List<TestCaseCompliance> testCaseSections = testCaseTasks.stream().map(ReportGenerator::await).toList();

        List<ComplianceResult> requirementResults = requirementSections.stream()
                .flatMap(section -> section.complianceResults().stream())
                .toList();
        List<ComplianceResult> testCaseResults = testCaseSections.stream()
                .flatMap(section -> section.complianceResults().stream())
                .toList();

        // ── Step 2: rollup per standard ──
        Map<String, StandardCompliance> overall =
                resultAggregator.overallCompliance(requirementResults, testCaseResults);

        // ── Step 3: recommendations ──
        List<String> recommendations = rankRecommendations(
                Stream.concat(requirementResults.stream(), testCaseResults.stream()).toList(),
                recommendationLimit);

        log.info("ReportGenerator: report completed: {} requirement results, {} test case results, {} standards",
                requirementResults.size(), testCaseResults.size(), overall.size());

        return new ComplianceReport(
                LocalDateTime.now(clock),
                new ReportSummary(requirements.size(), testCases.size(), ruleCatalog.standards()),
                requirementSections,
                testCaseSections,
                overall,
                recommendations);
    }

    /**
     * Generates a report and restricts it to the given standards. An empty filter keeps everything.
     */
    public ComplianceReport generate(List<Requirement> requirements, List<TestCase> testCases,
                                     Collection<String> standards) {
        ComplianceReport report = generate(requirements, testCases);
        if (standards == null || standards.isEmpty()) return report;
        log.info("ReportGenerator: filtering report to standards {}", standards);
        return report.restrictTo(standards);
    }

    /**
     * Counts every recommendation, orders by frequency (ties keep first-seen order) and keeps the top entries,
     * rendered as {@code "<text> (mentioned <n> times)"}.
     */
    static List<String> rankRecommendations(List<ComplianceResult> results, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ComplianceResult result : results) {
            for (String recommendation : result.recommendations()) {
                counts.merge(recommendation, 1, Integer::sum);
            }
        }

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(e -> "%s (mentioned %d times)".formatted(e.getKey(), e.getValue()))
                .toList();
    }

    // ═══════════════════════════════════════════════════
    // Internal helpers
    // ═══════════════════════════════════════════════════

    private RequirementCompliance assessRequirement(Requirement requirement) {
        try {
            return new RequirementCompliance(requirement.displayId(),
                    resultAggregator.assessRequirement(requirement));
        } catch (RuntimeException e) {
            throw new ComplianceEvaluationException(requirement.displayId(), e);
        }
    }

    private TestCaseCompliance assessTestCase(TestCase testCase, Requirement related) {
        try {
            return new TestCaseCompliance(testCase.displayId(),
                    resultAggregator.assessTestCase(testCase, related));
        } catch (RuntimeException e) {
            throw new ComplianceEvaluationException(testCase.displayId(), e);
        }
    }

    private Requirement relatedRequirement(TestCase testCase, Map<Long, Requirement> requirementsById) {
        if (testCase.requirementId() == null) return null;
        Requirement related = requirementsById.get(testCase.requirementId());
        if (related == null) {
            log.warn("ReportGenerator: test case '{}' references requirement {} which is not in the batch",
                    testCase.displayId(), testCase.requirementId());
        }
        return related;
    }

    private static <T> T await(CompletableFuture<T> task) {
        try {
            return task.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ComplianceEvaluationException evaluationError) {
                throw evaluationError;
            }
            throw e;
        }
    }
}
