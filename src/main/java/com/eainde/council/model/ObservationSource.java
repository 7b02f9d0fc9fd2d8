package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Which learning trigger produced an observation. */
public enum ObservationSource {
    OVERRIDE,
    OUTCOME,
    BOOTSTRAP;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ObservationSource fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
