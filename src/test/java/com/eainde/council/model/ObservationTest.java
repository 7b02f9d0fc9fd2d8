package com.eainde.council.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObservationTest {

    private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

    private final Observation draft = Observation.builder()
            .id("obs-1")
            .agentId("budget")
            .pattern("Teams asking over $100k without milestones rarely deliver.")
            .tags(List.of("budget"))
            .evidence(List.of("app-1"))
            .confidence(0.7)
            .source(ObservationSource.OVERRIDE)
            .createdAt(CREATED)
            .build();

    @Test
    void defaultsToDraft() {
        assertThat(draft.status()).isEqualTo(ObservationStatus.DRAFT);
        assertThat(draft.recency()).isEqualTo(CREATED);
    }

    @Test
    void activationRecordsReviewer() {
        Instant at = CREATED.plusSeconds(60);

        Observation active = draft.withStatus(ObservationStatus.ACTIVE, "alice", at);

        assertThat(active.status()).isEqualTo(ObservationStatus.ACTIVE);
        assertThat(active.validatedBy()).isEqualTo("alice");
        assertThat(active.validatedAt()).isEqualTo(at);
    }

    @Test
    void deprecatedIsTerminal() {
        Observation deprecated = draft.withStatus(ObservationStatus.DEPRECATED, "alice", CREATED);

        assertThatThrownBy(() -> deprecated.withStatus(ObservationStatus.ACTIVE, "bob", CREATED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void activeCannotGoBackToReviewed() {
        Observation active = draft.withStatus(ObservationStatus.ACTIVE, "alice", CREATED);

        assertThatThrownBy(() -> active.withStatus(ObservationStatus.REVIEWED, "bob", CREATED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void markUsedBumpsCounterAndRecency() {
        Instant used = CREATED.plusSeconds(3600);

        Observation marked = draft.markUsed(used);

        assertThat(marked.timesUsed()).isEqualTo(1);
        assertThat(marked.recency()).isEqualTo(used);
    }
}
