package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Aggregated outcome of one evaluation run. Stored under the application id, so a re-run replaces it.
 *
 * @param evaluations  final evaluation per agent, in roster order
 * @param history      every evaluation recorded during the run, initial ones first
 * @param stoppedEarly deliberation ended by convergence before the configured round limit
 */
@Builder(toBuilder = true)
public record CouncilDecision(
        @JsonProperty("id")                    String id,
        @JsonProperty("application_id")        String applicationId,
        @JsonProperty("evaluations")           List<AgentEvaluation> evaluations,
        @JsonProperty("history")               List<AgentEvaluation> history,
        @JsonProperty("average_score")         double averageScore,
        @JsonProperty("average_confidence")    double averageConfidence,
        @JsonProperty("score_variance")        double scoreVariance,
        @JsonProperty("recommendation")        Recommendation recommendation,
        @JsonProperty("auto_executed")         boolean autoExecuted,
        @JsonProperty("requires_human_review") boolean requiresHumanReview,
        @JsonProperty("review_reasons")        List<String> reviewReasons,
        @JsonProperty("synthesis")             String synthesis,
        @JsonProperty("applicant_feedback")    String applicantFeedback,
        @JsonProperty("deliberation_rounds")   int deliberationRounds,
        @JsonProperty("stopped_early")         boolean stoppedEarly,
        @JsonProperty("human_decision")        HumanDecision humanDecision,
        @JsonProperty("created_at")            Instant createdAt
) implements Serializable {

    public CouncilDecision {
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
        history = history == null ? List.of() : List.copyOf(history);
        reviewReasons = reviewReasons == null ? List.of() : List.copyOf(reviewReasons);
    }

    public CouncilDecision withHumanDecision(HumanDecision decision) {
        return toBuilder().humanDecision(decision).build();
    }
}
