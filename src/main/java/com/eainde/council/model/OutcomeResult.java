package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutcomeResult {
    SUCCESS,
    FAILURE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OutcomeResult fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
