package com.example.compliance.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Custom deserializer for Requirement.
 * Records produced by extraction tools are not always well-typed, so every field is read leniently.
 */
public class RequirementDeserializer extends JsonDeserializer<Requirement> {

    @Override
    public Requirement deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        return new Requirement(
                JsonFields.id(node, "id"),
                JsonFields.text(node, "requirement_id"),
                JsonFields.text(node, "title"),
                JsonFields.text(node, "description"),
                JsonFields.text(node, "type"),
                JsonFields.text(node, "priority"),
                JsonFields.text(node, "source_document"),
                JsonFields.textList(node, "regulatory_standards")
        );
    }
}
