package com.eainde.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A funding request. Immutable after creation; the only change the pipeline makes is the status,
 * and that goes through {@link #withStatus(ApplicationStatus)} so the transition table is enforced.
 */
@Builder(toBuilder = true)
public record Application(
        @JsonProperty("id")                 String id,
        @JsonProperty("title")              String title,
        @JsonProperty("summary")            String summary,
        @JsonProperty("description")        String description,
        @JsonProperty("team_name")          String teamName,
        @JsonProperty("wallet_address")     String walletAddress,
        @JsonProperty("team_members")       List<TeamMember> teamMembers,
        @JsonProperty("problem_statement")  String problemStatement,
        @JsonProperty("proposed_solution")  String proposedSolution,
        @JsonProperty("technical_approach") String technicalApproach,
        @JsonProperty("funding_requested")  double fundingRequested,
        @JsonProperty("currency")           String currency,
        @JsonProperty("milestones")         List<Milestone> milestones,
        @JsonProperty("status")             ApplicationStatus status,
        @JsonProperty("created_at")         Instant createdAt
) implements Serializable {

    public Application {
        Objects.requireNonNull(id, "id");
        teamMembers = teamMembers == null ? List.of() : List.copyOf(teamMembers);
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
        currency = currency == null ? "USD" : currency;
        status = status == null ? ApplicationStatus.PENDING : status;
    }

    /**
     * @throws IllegalStateException if the status table does not allow {@code status → target}
     */
    public Application withStatus(ApplicationStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Application " + id + " cannot move from " + status.value() + " to " + target.value());
        }
        return toBuilder().status(target).build();
    }

    /** Sum of milestone percentages; 100 is expected but not enforced. */
    public double milestonePercentageTotal() {
        return milestones.stream().mapToDouble(Milestone::fundingPercentage).sum();
    }
}
