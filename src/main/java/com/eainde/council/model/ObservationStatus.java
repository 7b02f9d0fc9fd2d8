package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * DRAFT is where the learning loop puts everything; only ACTIVE observations reach prompts.
 * REVIEWED is a recorded waypoint with no effect on retrieval. DEPRECATED is terminal.
 */
public enum ObservationStatus {
    DRAFT,
    REVIEWED,
    ACTIVE,
    DEPRECATED;

    public Set<ObservationStatus> allowedTargets() {
        return switch (this) {
            case DRAFT -> EnumSet.of(REVIEWED, ACTIVE, DEPRECATED);
            case REVIEWED -> EnumSet.of(ACTIVE, DEPRECATED);
            case ACTIVE -> EnumSet.of(DEPRECATED);
            case DEPRECATED -> EnumSet.noneOf(ObservationStatus.class);
        };
    }

    public boolean canTransitionTo(ObservationStatus target) {
        return allowedTargets().contains(target);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ObservationStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
