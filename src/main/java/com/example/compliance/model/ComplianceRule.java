package com.example.compliance.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A regulatory detection and scoring unit.
 *
 * @param ruleId              Unique identifier (e.g. FDA_820_001)
 * @param standard            Label of the standard the rule belongs to (e.g. "HIPAA")
 * @param title               Short rule title
 * @param description         What the rule checks
 * @param requirementPatterns Ordered, pre-compiled patterns applied to requirement text
 * @param testCasePatterns    Ordered, pre-compiled patterns applied to test case text
 * @param mandatory           Whether the standard makes this rule mandatory
 * @param riskLevel           Static risk copied onto every result of this rule
 * @param validationCriteria  Criterion name → "is required" flag
 */
public record ComplianceRule(
        String ruleId,
        String standard,
        String title,
        String description,
        List<Pattern> requirementPatterns,
        List<Pattern> testCasePatterns,
        boolean mandatory,
        RiskLevel riskLevel,
        Map<String, Boolean> validationCriteria
) {
    public ComplianceRule {
        requirementPatterns = requirementPatterns != null ? List.copyOf(requirementPatterns) : List.of();
        testCasePatterns = testCasePatterns != null ? List.copyOf(testCasePatterns) : List.of();
        validationCriteria = validationCriteria != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(validationCriteria))
                : Map.of();
        if (riskLevel == null) riskLevel = RiskLevel.UNKNOWN;
    }

    /** True when the criterion is present and flagged as required. */
    public boolean requires(String criterion) {
        return Boolean.TRUE.equals(validationCriteria.get(criterion));
    }
}
