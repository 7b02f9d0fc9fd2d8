package com.eainde.council.gateway;

import dev.langchain4j.model.chat.request.json.JsonSchema;

import java.util.List;

/**
 * Response shapes the council asks the model for.
 */
public enum CouncilSchema {

    EVALUATION("agent_evaluation", """
            {
              "type": "object",
              "properties": {
                "score":          { "type": "number", "description": "0 = strong reject, 0.5 = uncertain, 1 = strong approve" },
                "recommendation": { "type": "string", "enum": ["approve", "reject", "needs_review"] },
                "confidence":     { "type": "number", "description": "confidence in this assessment, 0 to 1" },
                "rationale":      { "type": "string" },
                "strengths":      { "type": "array", "items": { "type": "string" } },
                "concerns":       { "type": "array", "items": { "type": "string" } },
                "questions":      { "type": "array", "items": { "type": "string" } }
              },
              "required": ["score", "recommendation", "confidence", "rationale", "strengths", "concerns", "questions"],
              "additionalProperties": false
            }
            """),

    DELIBERATION("deliberation_revision", """
            {
              "type": "object",
              "properties": {
                "revised":            { "type": "boolean", "description": "whether the position changed after reading the peers" },
                "score":              { "type": "number" },
                "recommendation":     { "type": "string", "enum": ["approve", "reject", "needs_review"] },
                "confidence":         { "type": "number" },
                "rationale":          { "type": "string" },
                "strengths":          { "type": "array", "items": { "type": "string" } },
                "concerns":           { "type": "array", "items": { "type": "string" } },
                "questions":          { "type": "array", "items": { "type": "string" } },
                "revision_rationale": { "type": "string", "description": "what in the peer reviews moved or did not move the position" }
              },
              "required": ["revised", "score", "recommendation", "confidence", "rationale", "strengths", "concerns", "questions", "revision_rationale"],
              "additionalProperties": false
            }
            """),

    SYNTHESIS("council_synthesis", """
            {
              "type": "object",
              "properties": {
                "synthesis":          { "type": "string", "description": "internal summary of agreement, disagreement and the routing outcome" },
                "applicant_feedback": { "type": "string", "description": "constructive feedback addressed to the applicant" }
              },
              "required": ["synthesis", "applicant_feedback"],
              "additionalProperties": false
            }
            """),

    REFLECTION("learned_observations", """
            {
              "type": "object",
              "properties": {
                "observations": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "pattern":    { "type": "string" },
                      "tags":       { "type": "array", "items": { "type": "string" } },
                      "confidence": { "type": "number" }
                    },
                    "required": ["pattern", "tags", "confidence"],
                    "additionalProperties": false
                  }
                }
              },
              "required": ["observations"],
              "additionalProperties": false
            }
            """);

    private final String schemaName;
    private final String definition;
    private final List<String> requiredFields;
    private volatile JsonSchema jsonSchema;

    CouncilSchema(String schemaName, String definition) {
        this.schemaName = schemaName;
        this.definition = definition;
        this.requiredFields = List.copyOf(JsonSchemaConverter.requiredFields(definition));
    }

    public String schemaName() {
        return schemaName;
    }

    public String definition() {
        return definition;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public JsonSchema jsonSchema() {
        JsonSchema schema = jsonSchema;
        if (schema == null) {
            schema = JsonSchemaConverter.toLangChainSchema(schemaName, definition);
            jsonSchema = schema;
        }
        return schema;
    }
}
