package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

/**
 * Directed link between two traced artifacts.
 *
 * @param id         Link identifier
 * @param sourceType requirement, test_case or defect
 * @param sourceId   Internal id of the source
 * @param targetType requirement, test_case or defect
 * @param targetId   Internal id of the target
 * @param linkType   covers, derives_from, validates
 * @param createdAt  Creation time, may be null
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TraceabilityLink(
        Long id,
        String sourceType,
        Long sourceId,
        String targetType,
        Long targetId,
        String linkType,
        LocalDateTime createdAt
) {
    public static final String REQUIREMENT = "requirement";
    public static final String TEST_CASE = "test_case";

    public boolean connects(String fromType, String toType) {
        return fromType.equals(sourceType) && toType.equals(targetType);
    }
}
