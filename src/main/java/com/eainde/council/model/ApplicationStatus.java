package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of an {@link Application}.
 *
 * <pre>
 * PENDING ─► EVALUATING ─► DELIBERATING ─┬─► AUTO_APPROVED ─┐
 *                 ▲                      ├─► AUTO_REJECTED ─┼─► APPROVED | REJECTED
 *                 └──── re-evaluation ───┴─► NEEDS_REVIEW  ─┘
 * </pre>
 *
 * EVALUATING and DELIBERATING may also return to EVALUATING when an interrupted run is restarted.
 * APPROVED and REJECTED are terminal.
 */
public enum ApplicationStatus {
    PENDING,
    EVALUATING,
    DELIBERATING,
    AUTO_APPROVED,
    AUTO_REJECTED,
    NEEDS_REVIEW,
    APPROVED,
    REJECTED;

    public Set<ApplicationStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(EVALUATING);
            case EVALUATING -> EnumSet.of(DELIBERATING, EVALUATING);
            case DELIBERATING -> EnumSet.of(AUTO_APPROVED, AUTO_REJECTED, NEEDS_REVIEW, EVALUATING);
            case AUTO_APPROVED, AUTO_REJECTED, NEEDS_REVIEW -> EnumSet.of(APPROVED, REJECTED, EVALUATING);
            case APPROVED, REJECTED -> EnumSet.noneOf(ApplicationStatus.class);
        };
    }

    public boolean canTransitionTo(ApplicationStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    /** Statuses a human reviewer may decide on. */
    public boolean isAwaitingHumanDecision() {
        return this == AUTO_APPROVED || this == AUTO_REJECTED || this == NEEDS_REVIEW;
    }

    /** Statuses for which a funded outcome can be recorded. */
    public boolean isFunded() {
        return this == APPROVED || this == AUTO_APPROVED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApplicationStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
