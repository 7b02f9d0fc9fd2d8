package com.eainde.council.agent;

import com.eainde.council.model.Recommendation;

import java.util.List;

/**
 * Validated model answer, before it is stamped with ids, round and timestamps.
 *
 * @param revisionRationale only present on deliberation answers
 */
public record EvaluationDraft(
        double score,
        Recommendation recommendation,
        double confidence,
        String rationale,
        List<String> strengths,
        List<String> concerns,
        List<String> questions,
        String revisionRationale
) {
    public EvaluationDraft {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
