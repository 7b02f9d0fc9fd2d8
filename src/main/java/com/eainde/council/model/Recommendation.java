package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Recommendation {
    APPROVE,
    REJECT,
    NEEDS_REVIEW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of model or API input ("approve", "Needs Review", "needs-review").
     *
     * @throws IllegalArgumentException for anything outside the three values
     */
    @JsonCreator
    public static Recommendation fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("recommendation is missing");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Recommendation r : values()) {
            if (r.name().equals(normalized)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown recommendation: " + value);
    }
}
