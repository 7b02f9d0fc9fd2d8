package com.eainde.council.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * One entry of a run's progress stream. Stage events come in {@code started}/{@code complete} pairs; a run
 * ends with exactly one terminal {@link Type#COMPLETE} or {@link Type#ERROR} event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CouncilEvent(
        @JsonProperty("type")      Type type,
        @JsonProperty("stage")     String stage,
        @JsonProperty("status")    Status status,
        @JsonProperty("payload")   Map<String, Object> payload,
        @JsonProperty("timestamp") Instant timestamp
) {

    public static final String PARSING = "parsing";
    public static final String INITIAL_EVALUATION = "initial_evaluation";
    public static final String AGGREGATION = "aggregation";
    public static final String SYNTHESIS = "synthesis";

    public enum Type {
        STAGE, COMPLETE, ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Status {
        STARTED, COMPLETE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public CouncilEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static String deliberationRound(int round) {
        return "deliberation_round_" + round;
    }

    public static CouncilEvent started(String stage) {
        return new CouncilEvent(Type.STAGE, stage, Status.STARTED, Map.of(), Instant.now());
    }

    public static CouncilEvent completed(String stage, Map<String, Object> payload) {
        return new CouncilEvent(Type.STAGE, stage, Status.COMPLETE, payload, Instant.now());
    }

    public static CouncilEvent finished(Map<String, Object> payload) {
        return new CouncilEvent(Type.COMPLETE, null, null, payload, Instant.now());
    }

    public static CouncilEvent error(String message) {
        return new CouncilEvent(Type.ERROR, null, null,
                Map.of("message", message == null ? "unknown error" : message), Instant.now());
    }

    public boolean isTerminal() {
        return type != Type.STAGE;
    }
}
