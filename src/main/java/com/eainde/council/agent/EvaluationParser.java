package com.eainde.council.agent;

import com.eainde.council.gateway.SchemaViolationException;
import com.eainde.council.model.Recommendation;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a structured evaluation against the contract the rest of the pipeline relies on:
 * score and confidence numeric within [0, 1], a known recommendation, a non-blank rationale and string lists.
 */
@Component
public class EvaluationParser {

    public EvaluationDraft parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new SchemaViolationException("Evaluation is not a JSON object");
        }
        double score = unitInterval(node, "score");
        double confidence = unitInterval(node, "confidence");

        Recommendation recommendation;
        try {
            recommendation = Recommendation.fromValue(node.path("recommendation").asText(null));
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException("Evaluation has an invalid recommendation: " + e.getMessage(), e);
        }

        String rationale = node.path("rationale").asText("");
        if (rationale.isBlank()) {
            throw new SchemaViolationException("Evaluation has an empty rationale");
        }

        String revisionRationale = node.hasNonNull("revision_rationale") ? node.get("revision_rationale").asText() : null;

        return new EvaluationDraft(score, recommendation, confidence, rationale,
                stringList(node, "strengths"), stringList(node, "concerns"), stringList(node, "questions"),
                revisionRationale);
    }

    private static double unitInterval(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new SchemaViolationException("Evaluation field '" + field + "' must be a number");
        }
        double d = value.asDouble();
        if (Double.isNaN(d) || d < 0.0 || d > 1.0) {
            throw new SchemaViolationException("Evaluation field '" + field + "' is outside [0, 1]: " + d);
        }
        return d;
    }

    private static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new SchemaViolationException("Evaluation field '" + field + "' must be an array");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new SchemaViolationException("Evaluation field '" + field + "' must contain strings");
            }
            if (!item.asText().isBlank()) {
                items.add(item.asText().trim());
            }
        }
        return items;
    }
}
