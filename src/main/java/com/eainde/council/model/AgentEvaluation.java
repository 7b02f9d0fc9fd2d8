package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One agent's opinion at one point of a run.
 *
 * @param round               0 for the initial evaluation, N for a revision recorded in deliberation round N
 * @param priorScore          score this evaluation revised from, null for round 0
 * @param priorRecommendation recommendation this evaluation revised from, null for round 0
 * @param observationIds      ids of the learned observations that were in the agent's prompt
 * @param degraded            true when the agent could not be reached and a neutral placeholder was recorded
 */
@Builder(toBuilder = true)
public record AgentEvaluation(
        @JsonProperty("id")                   String id,
        @JsonProperty("application_id")       String applicationId,
        @JsonProperty("agent_id")             String agentId,
        @JsonProperty("agent_name")           String agentName,
        @JsonProperty("score")                double score,
        @JsonProperty("recommendation")       Recommendation recommendation,
        @JsonProperty("confidence")           double confidence,
        @JsonProperty("rationale")            String rationale,
        @JsonProperty("strengths")            List<String> strengths,
        @JsonProperty("concerns")             List<String> concerns,
        @JsonProperty("questions")            List<String> questions,
        @JsonProperty("round")                int round,
        @JsonProperty("prior_score")          Double priorScore,
        @JsonProperty("prior_recommendation") Recommendation priorRecommendation,
        @JsonProperty("revision_rationale")   String revisionRationale,
        @JsonProperty("observation_ids")      List<String> observationIds,
        @JsonProperty("degraded")             boolean degraded,
        @JsonProperty("created_at")           Instant createdAt
) implements Serializable {

    public AgentEvaluation {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        questions = questions == null ? List.of() : List.copyOf(questions);
        observationIds = observationIds == null ? List.of() : List.copyOf(observationIds);
    }

    @JsonIgnore
    public boolean isRevision() {
        return priorScore != null;
    }
}
