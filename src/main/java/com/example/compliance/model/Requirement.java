package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Caller-supplied snapshot of a requirement.
 * Missing text fields default to the empty string, missing lists to empty lists.
 *
 * @param id                  Internal identifier, referenced by {@link TestCase#requirementId()}
 * @param requirementId       Public identifier (e.g. REQ-001)
 * @param title               Requirement title
 * @param description         Requirement text
 * @param type                functional, non-functional, regulatory
 * @param priority            high, medium, low
 * @param sourceDocument      Document the requirement was extracted from
 * @param regulatoryStandards Standards the requirement is declared against
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonDeserialize(using = RequirementDeserializer.class)
public record Requirement(
        Long id,
        String requirementId,
        String title,
        String description,
        String type,
        String priority,
        String sourceDocument,
        List<String> regulatoryStandards
) {
    public Requirement {
        requirementId = requirementId != null ? requirementId : "";
        title = title != null ? title : "";
        description = description != null ? description : "";
        type = type != null ? type : "";
        priority = priority != null ? priority : "";
        sourceDocument = sourceDocument != null ? sourceDocument : "";
        regulatoryStandards = regulatoryStandards != null
                ? regulatoryStandards.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    /** Title and description, lower-cased: the text rules are matched against. */
    public String searchableText() {
        return (title + " " + description).toLowerCase(Locale.ROOT);
    }

    /** Identifier shown in reports. */
    public String displayId() {
        return requirementId.isEmpty() ? "Unknown" : requirementId;
    }
}
