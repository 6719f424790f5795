package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Outcome of evaluating one entity against one rule.
 *
 * @param ruleId          Rule that produced the result
 * @param standard        Standard of that rule
 * @param complianceLevel Score-derived verdict
 * @param score           Combined score, always within [0,1]
 * @param findings        Human-readable findings
 * @param recommendations Suggested corrective actions
 * @param evidence        Matched patterns and other supporting facts
 * @param riskAssessment  Risk level copied from the rule
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComplianceResult(
        String ruleId,
        String standard,
        ComplianceLevel complianceLevel,
        double score,
        List<String> findings,
        List<String> recommendations,
        List<String> evidence,
        RiskLevel riskAssessment
) {
    public ComplianceResult {
        findings = findings != null ? List.copyOf(findings) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        score = Math.max(0.0, Math.min(1.0, score));
    }

    /** Placeholder for a rule that found no evidence; callers drop it. */
    public static ComplianceResult unknown(ComplianceRule rule) {
        return new ComplianceResult(rule.ruleId(), rule.standard(), ComplianceLevel.UNKNOWN, 0.0,
                List.of(), List.of(), List.of(), RiskLevel.UNKNOWN);
    }

    @JsonIgnore
    public boolean isKnown() {
        return complianceLevel != ComplianceLevel.UNKNOWN;
    }
}
