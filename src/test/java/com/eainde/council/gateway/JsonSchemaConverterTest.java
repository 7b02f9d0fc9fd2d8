package com.eainde.council.gateway;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    @Test
    void toLangChainSchema_shouldParseSimpleObjectWithPrimitives() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "rationale": { "type": "string", "description": "Why" },
                    "score": { "type": "number" },
                    "revised": { "type": "boolean" }
                  },
                  "required": ["rationale"]
                }
                """;

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("Evaluation", json);

        // Assert
        assertThat(result.name()).isEqualTo("Evaluation");
        assertThat(result.rootElement()).isInstanceOf(JsonObjectSchema.class);
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();

        assertThat(root.properties()).containsOnlyKeys("rationale", "score", "revised");
        JsonSchemaElement rationale = root.properties().get("rationale");
        assertThat(rationale).isInstanceOf(JsonStringSchema.class);
        assertThat(rationale.description()).isEqualTo("Why");
        assertThat(root.properties().get("score")).isInstanceOf(JsonNumberSchema.class);
        assertThat(root.required()).containsExactly("rationale");
    }

    @Test
    void toLangChainSchema_shouldParseArraysOfObjects() {
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "observations": {
                      "type": "array",
                      "items": {
                        "type": "object",
                        "properties": { "pattern": { "type": "string" } }
                      }
                    }
                  }
                }
                """;

        JsonSchema result = JsonSchemaConverter.toLangChainSchema("Reflection", json);

        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.properties().get("observations")).isInstanceOf(JsonArraySchema.class);
        JsonArraySchema array = (JsonArraySchema) root.properties().get("observations");
        assertThat(array.items()).isInstanceOf(JsonObjectSchema.class);
        assertThat(((JsonObjectSchema) array.items()).properties()).containsKey("pattern");
    }

    @Test
    void toLangChainSchema_shouldParseEnums() {
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "recommendation": { "type": "string", "enum": ["approve", "reject", "needs_review"] }
                  }
                }
                """;

        JsonSchema result = JsonSchemaConverter.toLangChainSchema("EnumTest", json);

        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        JsonEnumSchema recommendation = (JsonEnumSchema) root.properties().get("recommendation");
        assertThat(recommendation.enumValues()).containsExactly("approve", "reject", "needs_review");
    }

    @Test
    void toLangChainSchema_shouldThrowException_whenJsonIsInvalid() {
        String invalidJson = "{ \"type\": \"object\", ... INVALID SYNTAX ... }";

        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("FailTest", invalidJson))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON Schema string");
    }

    @Test
    void toLangChainSchema_shouldRejectUnsupportedTypes() {
        String json = "{ \"type\": \"object\", \"properties\": { \"x\": { \"type\": \"null\" } } }";

        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("NullTest", json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported schema type");
    }

    @Test
    void councilSchemasAllConvert() {
        for (CouncilSchema schema : CouncilSchema.values()) {
            assertThat(schema.jsonSchema().name()).isEqualTo(schema.schemaName());
            assertThat(schema.requiredFields()).isNotEmpty();
        }
        assertThat(CouncilSchema.EVALUATION.requiredFields())
                .contains("score", "recommendation", "confidence", "rationale");
        assertThat(CouncilSchema.DELIBERATION.requiredFields()).contains("revision_rationale");
    }
}
