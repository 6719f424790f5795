package com.example.compliance.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Custom deserializer for TestCase.
 * A {@code test_steps} value that is not an array is read as "no steps" so scoring stays best-effort.
 */
public class TestCaseDeserializer extends JsonDeserializer<TestCase> {

    @Override
    public TestCase deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        return new TestCase(
                JsonFields.id(node, "id"),
                JsonFields.text(node, "test_case_id"),
                JsonFields.text(node, "title"),
                JsonFields.text(node, "description"),
                JsonFields.text(node, "preconditions"),
                JsonFields.textList(node, "test_steps"),
                JsonFields.text(node, "expected_results"),
                JsonFields.text(node, "postconditions"),
                JsonFields.text(node, "priority"),
                JsonFields.object(node, "test_data"),
                JsonFields.textList(node, "compliance_tags"),
                JsonFields.id(node, "requirement_id")
        );
    }
}
