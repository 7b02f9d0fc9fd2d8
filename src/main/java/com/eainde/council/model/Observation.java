package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A learned pattern owned by one agent and injected into that agent's future prompts once active.
 *
 * @param evidence     ids of the applications the pattern was derived from
 * @param lastUsedAt   last time the observation was placed in a prompt, null if never
 * @param flaggedStale set by pruning; deprecation stays a human action
 */
@Builder(toBuilder = true)
public record Observation(
        @JsonProperty("id")            String id,
        @JsonProperty("agent_id")      String agentId,
        @JsonProperty("pattern")       String pattern,
        @JsonProperty("tags")          List<String> tags,
        @JsonProperty("evidence")      List<String> evidence,
        @JsonProperty("confidence")    double confidence,
        @JsonProperty("status")        ObservationStatus status,
        @JsonProperty("source")        ObservationSource source,
        @JsonProperty("times_used")    int timesUsed,
        @JsonProperty("times_helpful") int timesHelpful,
        @JsonProperty("created_at")    Instant createdAt,
        @JsonProperty("last_used_at")  Instant lastUsedAt,
        @JsonProperty("validated_by")  String validatedBy,
        @JsonProperty("validated_at")  Instant validatedAt,
        @JsonProperty("flagged_stale") boolean flaggedStale
) implements Serializable {

    public Observation {
        tags = tags == null ? List.of() : List.copyOf(tags);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        status = status == null ? ObservationStatus.DRAFT : status;
    }

    /**
     * @throws IllegalStateException when the lifecycle does not allow the move
     */
    public Observation withStatus(ObservationStatus target, String reviewer, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Observation " + id + " cannot move from " + status.value() + " to " + target.value());
        }
        return toBuilder().status(target).validatedBy(reviewer).validatedAt(at).build();
    }

    public Observation markUsed(Instant at) {
        return toBuilder().timesUsed(timesUsed + 1).lastUsedAt(at).build();
    }

    /** Recency used for ranking: last use, or creation when never used. */
    public Instant recency() {
        return lastUsedAt != null ? lastUsedAt : createdAt;
    }
}
