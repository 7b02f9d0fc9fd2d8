package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * @param override true when the human disagreed with the council or the council had asked for review
 */
public record HumanDecision(
        @JsonProperty("decision")   Recommendation decision,
        @JsonProperty("rationale")  String rationale,
        @JsonProperty("reviewer")   String reviewer,
        @JsonProperty("decided_at") Instant decidedAt,
        @JsonProperty("override")   boolean override
) implements Serializable {}
