package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Catalog statistics for a supported standard.
 *
 * @param name           Standard label
 * @param rulesCount     Rules defined for the standard
 * @param mandatoryRules Rules flagged mandatory
 * @param highRiskRules  Rules with {@link RiskLevel#HIGH}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StandardInfo(
        String name,
        int rulesCount,
        int mandatoryRules,
        int highRiskRules
) {}
