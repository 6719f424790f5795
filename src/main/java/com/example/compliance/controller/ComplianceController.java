package com.example.compliance.controller;

import com.example.compliance.model.ComplianceReport;
import com.example.compliance.model.ComplianceResult;
import com.example.compliance.model.CoverageRequest;
import com.example.compliance.model.ReportRequest;
import com.example.compliance.model.Requirement;
import com.example.compliance.model.RequirementAssessment;
import com.example.compliance.model.StandardInfo;
import com.example.compliance.model.TestCaseAssessment;
import com.example.compliance.model.TestCaseAssessmentRequest;
import com.example.compliance.model.TraceabilityRequest;
import com.example.compliance.rules.RuleCatalog;
import com.example.compliance.service.CoverageValidator;
import com.example.compliance.service.ReportGenerator;
import com.example.compliance.service.ResultAggregator;
import com.example.compliance.service.TraceabilityAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for compliance assessment.
 * <p>
 * Stateless: entities are supplied in the request body and nothing is stored.
 */
@RestController
@RequestMapping("/api")
public class ComplianceController {

    private static final Logger log = LoggerFactory.getLogger(ComplianceController.class);

    private final RuleCatalog ruleCatalog;
    private final ResultAggregator resultAggregator;
    private final ReportGenerator reportGenerator;
    private final CoverageValidator coverageValidator;
    private final TraceabilityAnalyzer traceabilityAnalyzer;

    public ComplianceController(RuleCatalog ruleCatalog,
                                ResultAggregator resultAggregator,
                                ReportGenerator reportGenerator,
                                CoverageValidator coverageValidator,
                                TraceabilityAnalyzer traceabilityAnalyzer) {
        this.ruleCatalog = ruleCatalog;
        this.resultAggregator = resultAggregator;
        this.reportGenerator = reportGenerator;
        this.coverageValidator = coverageValidator;
        this.traceabilityAnalyzer = traceabilityAnalyzer;
    }

    /**
     * Lists the supported standards with their rule statistics.
     *
     * <p>Endpoint: GET /api/compliance/standards
     */
    @GetMapping("/compliance/standards")
    public ResponseEntity<Map<String, Object>> standards() {
        List<StandardInfo> standards = ruleCatalog.describeStandards();
        return ResponseEntity.ok(Map.of(
                "standards", standards,
                "total_standards", standards.size()
        ));
    }

    /**
     * Assesses a single requirement against every rule.
     *
     * <p>Endpoint: POST /api/compliance/assess-requirement
     */
    @PostMapping("/compliance/assess-requirement")
    public ResponseEntity<?> assessRequirement(@RequestBody(required = false) Requirement requirement) {
        if (requirement == null) {
            return badRequest("Missing requirement in request body.");
        }
        try {
            List<ComplianceResult> results = resultAggregator.assessRequirement(requirement);
            log.info("Requirement '{}' assessed: {} results", requirement.displayId(), results.size());
            return ResponseEntity.ok(RequirementAssessment.of(requirement, results));
        } catch (Exception e) {
            log.error("Error assessing requirement '{}'", requirement.displayId(), e);
            return serverError("Error assessing requirement compliance", e);
        }
    }

    /**
     * Assesses a single test case, optionally with the requirement it verifies.
     *
     * <p>Endpoint: POST /api/compliance/assess-test-case
     */
    @PostMapping("/compliance/assess-test-case")
    public ResponseEntity<?> assessTestCase(@RequestBody(required = false) TestCaseAssessmentRequest request) {
        if (request == null || request.testCase() == null) {
            return badRequest("Missing test_case in request body.");
        }
        try {
            List<ComplianceResult> results =
                    resultAggregator.assessTestCase(request.testCase(), request.requirement());
            log.info("Test case '{}' assessed: {} results", request.testCase().displayId(), results.size());
            return ResponseEntity.ok(TestCaseAssessment.of(request.testCase(), request.requirement(), results));
        } catch (Exception e) {
            log.error("Error assessing test case '{}'", request.testCase().displayId(), e);
            return serverError("Error assessing test case compliance", e);
        }
    }

    /**
     * Generates the compliance report, filtered by {@code standards} when given.
     *
     * <p>Endpoint: POST /api/compliance/report
     */
    @PostMapping("/compliance/report")
    public ResponseEntity<?> report(@RequestBody(required = false) ReportRequest request) {
        ReportRequest body = request != null ? request : new ReportRequest(null, null, null);
        try {
            ComplianceReport report = reportGenerator.generate(body.requirements(), body.testCases(), body.standards());
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("Error generating compliance report", e);
            return serverError("Error generating compliance report", e);
        }
    }

    /**
     * Validates test coverage of the requirements, optionally for one standard.
     *
     * <p>Endpoint: POST /api/compliance/validate-coverage
     */
    @PostMapping("/compliance/validate-coverage")
    public ResponseEntity<?> validateCoverage(@RequestBody(required = false) CoverageRequest request) {
        CoverageRequest body = request != null ? request : new CoverageRequest(null, null, null);
        try {
            return ResponseEntity.ok(
                    coverageValidator.validate(body.standard(), body.requirements(), body.testCases()));
        } catch (Exception e) {
            log.error("Error validating test coverage", e);
            return serverError("Error validating test coverage", e);
        }
    }

    /**
     * Builds the traceability matrix from the supplied links.
     *
     * <p>Endpoint: POST /api/traceability/matrix
     */
    @PostMapping("/traceability/matrix")
    public ResponseEntity<?> traceabilityMatrix(@RequestBody(required = false) TraceabilityRequest request) {
        TraceabilityRequest body = request != null ? request : new TraceabilityRequest(null, null, null);
        try {
            return ResponseEntity.ok(
                    traceabilityAnalyzer.analyze(body.requirements(), body.testCases(), body.links()));
        } catch (Exception e) {
            log.error("Error generating traceability matrix", e);
            return serverError("Error generating traceability matrix", e);
        }
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "compliance-engine",
                "rules", ruleCatalog.allRules().size()
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private ResponseEntity<Map<String, String>> serverError(String error, Exception e) {
        return ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", error,
                        "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                ));
    }
}
