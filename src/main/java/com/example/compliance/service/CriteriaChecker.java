package com.example.compliance.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword heuristics for a rule's validation criteria.
 * <p>
 * A required criterion is satisfied when the text contains any keyword mapped to it.
 * Criteria without a keyword mapping are ignored and do not lower the ratio.
 */
@Component
public class CriteriaChecker {

    private static final Logger log = LoggerFactory.getLogger(CriteriaChecker.class);

    /** Criterion name → keywords, any of which satisfies it. */
    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("requires_traceability", List.of("traceability", "trace"));
        KEYWORDS.put("requires_verification", List.of("verify", "verification"));
        KEYWORDS.put("requires_validation", List.of("validate", "validation"));
        KEYWORDS.put("requires_risk_analysis", List.of("risk", "hazard"));
        KEYWORDS.put("requires_security_testing", List.of("security", "secure"));
        KEYWORDS.put("requires_documentation", List.of("document", "record"));
        KEYWORDS.put("requires_design_control", List.of("design"));
        KEYWORDS.put("requires_mitigation", List.of("mitigat"));
        KEYWORDS.put("requires_access_control", List.of("access control", "authoriz", "permission"));
        KEYWORDS.put("requires_privacy_protection", List.of("privacy", "confidential"));
        KEYWORDS.put("requires_audit_trail", List.of("audit", "log"));
        KEYWORDS.put("requires_consent_management", List.of("consent"));
        KEYWORDS.put("requires_testing", List.of("test"));
    }

    /**
     * Ratio of satisfied criteria among the required ones that have a keyword mapping.
     *
     * @param text     lower-cased title and description
     * @param criteria criterion name → required flag
     * @return value in [0,1]; 1.0 when nothing checkable is required
     */
    public double satisfactionRatio(String text, Map<String, Boolean> criteria) {
        String haystack = text != null ? text : "";
        int checked = 0;
        int satisfied = 0;

        for (Map.Entry<String, Boolean> criterion : criteria.entrySet()) {
            if (!Boolean.TRUE.equals(criterion.getValue())) continue;

            List<String> keywords = KEYWORDS.get(criterion.getKey());
            if (keywords == null) {
                log.debug("CriteriaChecker: no keywords for '{}', skipped", criterion.getKey());
                continue;
            }
            checked++;
            if (keywords.stream().anyMatch(haystack::contains)) {
                satisfied++;
            }
        }

        return checked == 0 ? 1.0 : (double) satisfied / checked;
    }

    public boolean isKnown(String criterion) {
        return KEYWORDS.containsKey(criterion);
    }
}
