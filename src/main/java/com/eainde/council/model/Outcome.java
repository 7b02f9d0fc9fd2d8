package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/** Real-world result of a funded application, recorded after the fact. */
public record Outcome(
        @JsonProperty("application_id") String applicationId,
        @JsonProperty("result")         OutcomeResult result,
        @JsonProperty("notes")          String notes,
        @JsonProperty("recorded_at")    Instant recordedAt
) implements Serializable {}
