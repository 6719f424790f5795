package com.example.compliance;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.TestCase;
import com.example.compliance.rules.RuleCatalog;
import com.example.compliance.service.CompletenessScorer;
import com.example.compliance.service.CriteriaChecker;
import com.example.compliance.service.PatternMatcher;
import com.example.compliance.service.ResultAggregator;
import com.example.compliance.service.ScoringEngine;

import java.util.List;
import java.util.Map;

/**
 * Shared test data and hand-wired engine components.
 */
public final class Fixtures {

    public static final String FDA_DESIGN_TEXT = "The system shall perform risk analysis and hazard identification "
            + "for all patient data flows, with full traceability to design inputs";

    private Fixtures() {
    }

    public static ScoringEngine scoringEngine() {
        return new ScoringEngine(new PatternMatcher(), new CriteriaChecker(), new CompletenessScorer());
    }

    public static ResultAggregator resultAggregator(RuleCatalog catalog) {
        return new ResultAggregator(catalog, scoringEngine());
    }

    public static ComplianceProperties defaultProperties() {
        return new ComplianceProperties(null, null);
    }

    public static Requirement requirement(Long id, String requirementId, String title, String description,
                                          String... standards) {
        return new Requirement(id, requirementId, title, description, "regulatory", "high",
                "srs.pdf", List.of(standards));
    }

    /** A test case with every completeness field populated. */
    public static TestCase completeTestCase(Long id, String testCaseId, String title, String description,
                                            List<String> steps, Long requirementId) {
        return new TestCase(id, testCaseId, title, description, "System is deployed",
                steps, "Expected behaviour is observed", "System returns to idle", "high",
                Map.of(), List.of(), requirementId);
    }

    public static TestCase bareTestCase(String testCaseId, String title, List<String> steps) {
        return new TestCase(null, testCaseId, title, null, null, steps, null, null, null,
                null, null, null);
    }

    /** Requirement linked to the access control test case (id 10). */
    public static Requirement accessControlRequirement() {
        return requirement(10L, "REQ-010", "Patient record protection",
                "Patient records shall be protected with encryption at rest and role-based access control.",
                RuleCatalog.ISO_27001);
    }

    public static TestCase accessControlTestCase() {
        return completeTestCase(20L, "TC-020", "Access control verification",
                "Verify that only authorised users can open patient records",
                List.of("Verify access control for clinician role",
                        "Run authentication test with invalid password"),
                10L);
    }
}
