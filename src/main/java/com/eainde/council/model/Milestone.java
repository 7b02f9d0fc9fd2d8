package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param fundingPercentage share of the requested funding tied to this milestone; advisory, never normalised
 */
public record Milestone(
        @JsonProperty("title")              String title,
        @JsonProperty("description")        String description,
        @JsonProperty("funding_percentage") double fundingPercentage
) implements Serializable {}
