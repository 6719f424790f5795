package com.example.compliance.rules;

import com.example.compliance.model.ComplianceRule;
import com.example.compliance.model.RiskLevel;
import com.example.compliance.model.StandardInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Read-only catalog of the compliance rules, indexed by rule id.
 * <p>
 * Built once at startup and never mutated, so it is shared by all evaluations without locking.
 * Every pattern is compiled (case-insensitive) during construction: a malformed expression,
 * a duplicate rule id or an unsupported standard label fails fast with {@link RuleCatalogException}.
 */
@Component
public class RuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalog.class);

    public static final String FDA_820 = "FDA 21 CFR Part 820";
    public static final String IEC_62304 = "IEC 62304";
    public static final String ISO_13485 = "ISO 13485";
    public static final String ISO_9001 = "ISO 9001";
    public static final String ISO_27001 = "ISO 27001";
    public static final String HIPAA = "HIPAA";
    public static final String GDPR = "GDPR";

    /** Supported standards, in reporting order. */
    public static final List<String> STANDARDS = List.of(
            FDA_820, IEC_62304, ISO_13485, ISO_9001, ISO_27001, HIPAA, GDPR);

    private final Map<String, ComplianceRule> rules;

    public RuleCatalog() {
        this(defaultRules());
    }

    public RuleCatalog(Collection<ComplianceRule> definitions) {
        Map<String, ComplianceRule> indexed = new LinkedHashMap<>();
        for (ComplianceRule rule : definitions) {
            if (!STANDARDS.contains(rule.standard())) {
                throw new RuleCatalogException(
                        "Rule %s references unsupported standard '%s'".formatted(rule.ruleId(), rule.standard()));
            }
            if (indexed.putIfAbsent(rule.ruleId(), rule) != null) {
                throw new RuleCatalogException("Duplicate rule id: " + rule.ruleId());
            }
        }
        this.rules = Collections.unmodifiableMap(indexed);
        log.info("RuleCatalog: {} rules loaded for {} standards", rules.size(), STANDARDS.size());
    }

    public List<ComplianceRule> allRules() {
        return List.copyOf(rules.values());
    }

    public List<ComplianceRule> rulesForStandard(String standard) {
        return rules.values().stream()
                .filter(r -> r.standard().equals(standard))
                .toList();
    }

    public Optional<ComplianceRule> rule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public List<String> standards() {
        return STANDARDS;
    }

    /**
     * Per-standard statistics: rule count, mandatory rules and high-risk rules.
     */
    public List<StandardInfo> describeStandards() {
        return STANDARDS.stream()
                .map(standard -> {
                    List<ComplianceRule> forStandard = rulesForStandard(standard);
                    int mandatory = (int) forStandard.stream().filter(ComplianceRule::mandatory).count();
                    int highRisk = (int) forStandard.stream()
                            .filter(r -> r.riskLevel() == RiskLevel.HIGH)
                            .count();
                    return new StandardInfo(standard, forStandard.size(), mandatory, highRisk);
                })
                .toList();
    }

    /**
     * Compiles detection patterns in case-insensitive mode.
     *
     * @param ruleId  owning rule, used in the error message
     * @param regexes source expressions
     * @return compiled patterns, same order
     * @throws RuleCatalogException if any expression does not compile
     */
    public static List<Pattern> compilePatterns(String ruleId, List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            try {
                compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new RuleCatalogException(
                        "Rule %s has a malformed pattern '%s'".formatted(ruleId, regex), e);
            }
        }
        return compiled;
    }

    // ═══════════════════════════════════════════════════
    // Rule definitions
    // ═══════════════════════════════════════════════════

    private static List<ComplianceRule> defaultRules() {
        List<ComplianceRule> rules = new ArrayList<>();

        // ── FDA 21 CFR Part 820 ──
        rules.add(define("FDA_820_001", FDA_820, "Design Controls",
                "Software development must follow design control procedures",
                List.of(
                        "design\\s+control",
                        "design\\s+inputs?",
                        "design\\s+(?:outputs?|reviews?|verification|validation)",
                        "risk\\s+analysis",
                        "hazard\\s+(?:analysis|identification)",
                        "traceability"),
                List.of(
                        "verify\\s+design",
                        "validate\\s+design",
                        "design\\s+review",
                        "traceability"),
                true, RiskLevel.HIGH,
                criteria("requires_design_control", "requires_traceability")));

        rules.add(define("FDA_820_002", FDA_820, "Risk Management",
                "Risk analysis and management throughout development",
                List.of(
                        "risk\\s+analysis",
                        "risk\\s+management",
                        "hazard\\s+analysis",
                        "failure\\s+mode"),
                List.of(
                        "risk\\s+test",
                        "safety\\s+test",
                        "hazard\\s+test",
                        "failure\\s+test"),
                true, RiskLevel.HIGH,
                criteria("requires_risk_analysis", "requires_mitigation")));

        // ── IEC 62304 ──
        rules.add(define("IEC_62304_001", IEC_62304, "Software Safety Classification",
                "Software must be classified according to safety requirements",
                List.of(
                        "safety\\s+class",
                        "class\\s+[abc]",
                        "safety\\s+classification",
                        "medical\\s+device\\s+software"),
                List.of(
                        "safety\\s+test",
                        "class\\s+[abc]\\s+test",
                        "safety\\s+verification"),
                true, RiskLevel.HIGH,
                criteria("requires_classification", "requires_safety_analysis", "requires_verification")));

        rules.add(define("IEC_62304_002", IEC_62304, "Software Development Lifecycle",
                "Structured software development process",
                List.of(
                        "software\\s+development\\s+plan",
                        "development\\s+lifecycle",
                        "software\\s+architecture",
                        "software\\s+design"),
                List.of(
                        "integration\\s+test",
                        "system\\s+test",
                        "software\\s+test",
                        "unit\\s+test"),
                true, RiskLevel.MEDIUM,
                criteria("requires_documentation", "requires_testing")));

        // ── ISO 13485 ──
        rules.add(define("ISO_13485_001", ISO_13485, "Quality Management System",
                "Quality management system for medical devices",
                List.of(
                        "quality\\s+management",
                        "qms",
                        "quality\\s+system",
                        "quality\\s+control"),
                List.of(
                        "quality\\s+test",
                        "qms\\s+test",
                        "quality\\s+verification"),
                true, RiskLevel.MEDIUM,
                criteria("requires_documentation", "requires_procedures")));

        // ── ISO 9001 ──
        rules.add(define("ISO_9001_001", ISO_9001, "Documented Information and Improvement",
                "Controlled documentation, corrective action and continual improvement",
                List.of(
                        "documented\\s+information",
                        "document\\s+control",
                        "continual\\s+improvement",
                        "corrective\\s+action",
                        "customer\\s+satisfaction",
                        "internal\\s+audit"),
                List.of(
                        "acceptance\\s+test",
                        "regression\\s+test",
                        "audit\\s+test"),
                false, RiskLevel.LOW,
                criteria("requires_documentation", "requires_validation")));

        // ── ISO 27001 ──
        rules.add(define("ISO_27001_001", ISO_27001, "Information Security Management",
                "Information security controls and management",
                List.of(
                        "information\\s+security",
                        "data\\s+security",
                        "security\\s+control",
                        "access\\s+control",
                        "encryption",
                        "authentication"),
                List.of(
                        "security\\s+test",
                        "access\\s+control\\s+test",
                        "authentication\\s+test",
                        "encryption\\s+test",
                        "penetration\\s+test"),
                true, RiskLevel.HIGH,
                criteria("requires_security_testing", "requires_access_control")));

        // ── HIPAA ──
        rules.add(define("HIPAA_001", HIPAA, "Protected Health Information",
                "Protection of patient health information",
                List.of(
                        "protected\\s+health\\s+information",
                        "phi",
                        "patient\\s+data",
                        "health\\s+information",
                        "privacy",
                        "confidentiality"),
                List.of(
                        "privacy\\s+test",
                        "phi\\s+test",
                        "data\\s+protection\\s+test",
                        "confidentiality\\s+test"),
                true, RiskLevel.HIGH,
                criteria("requires_privacy_protection", "requires_audit_trail")));

        rules.add(define("HIPAA_002", HIPAA, "Audit Controls and Integrity",
                "Recording of access to electronic health information and protection of its integrity",
                List.of(
                        "audit\\s+(?:trail|log|controls?)",
                        "activity\\s+log",
                        "integrity\\s+controls?",
                        "transmission\\s+security",
                        "automatic\\s+logoff"),
                List.of(
                        "audit\\s+log\\s+test",
                        "logging\\s+test",
                        "integrity\\s+test",
                        "session\\s+timeout\\s+test"),
                true, RiskLevel.HIGH,
                criteria("requires_audit_trail", "requires_security_testing")));

        // ── GDPR ──
        rules.add(define("GDPR_001", GDPR, "Data Protection and Privacy",
                "General Data Protection Regulation compliance",
                List.of(
                        "data\\s+protection",
                        "gdpr",
                        "personal\\s+data",
                        "data\\s+subject\\s+rights",
                        "consent",
                        "data\\s+processing"),
                List.of(
                        "gdpr\\s+test",
                        "data\\s+protection\\s+test",
                        "consent\\s+test",
                        "data\\s+subject\\s+test",
                        "privacy\\s+test"),
                true, RiskLevel.HIGH,
                criteria("requires_consent_management", "requires_data_subject_rights")));

        return rules;
    }

    private static ComplianceRule define(String ruleId, String standard, String title, String description,
                                         List<String> requirementPatterns, List<String> testCasePatterns,
                                         boolean mandatory, RiskLevel riskLevel,
                                         Map<String, Boolean> validationCriteria) {
        return new ComplianceRule(ruleId, standard, title, description,
                compilePatterns(ruleId, requirementPatterns),
                compilePatterns(ruleId, testCasePatterns),
                mandatory, riskLevel, validationCriteria);
    }

    private static Map<String, Boolean> criteria(String... required) {
        Map<String, Boolean> criteria = new LinkedHashMap<>();
        for (String name : required) {
            criteria.put(name, Boolean.TRUE);
        }
        return criteria;
    }
}
