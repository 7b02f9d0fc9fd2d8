package com.eainde.council.model;

import com.eainde.council.CouncilFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicationStatusTest {

    @Nested
    @DisplayName("Transition table")
    class Transitions {

        @Test
        @DisplayName("pipeline path pending -> evaluating -> deliberating -> routed")
        void pipelinePath() {
            assertThat(ApplicationStatus.PENDING.canTransitionTo(ApplicationStatus.EVALUATING)).isTrue();
            assertThat(ApplicationStatus.EVALUATING.canTransitionTo(ApplicationStatus.DELIBERATING)).isTrue();
            assertThat(ApplicationStatus.DELIBERATING.allowedTargets()).contains(
                    ApplicationStatus.AUTO_APPROVED, ApplicationStatus.AUTO_REJECTED, ApplicationStatus.NEEDS_REVIEW);
        }

        @Test
        @DisplayName("pending cannot skip straight to a routed status")
        void noSkipping() {
            assertThat(ApplicationStatus.PENDING.canTransitionTo(ApplicationStatus.AUTO_APPROVED)).isFalse();
            assertThat(ApplicationStatus.EVALUATING.canTransitionTo(ApplicationStatus.NEEDS_REVIEW)).isFalse();
        }

        @ParameterizedTest
        @EnumSource(value = ApplicationStatus.class, names = {"AUTO_APPROVED", "AUTO_REJECTED", "NEEDS_REVIEW"})
        @DisplayName("routed statuses accept a human decision or re-evaluation")
        void routedStatuses(ApplicationStatus status) {
            assertThat(status.allowedTargets()).containsExactlyInAnyOrder(
                    ApplicationStatus.APPROVED, ApplicationStatus.REJECTED, ApplicationStatus.EVALUATING);
            assertThat(status.isAwaitingHumanDecision()).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = ApplicationStatus.class, names = {"APPROVED", "REJECTED"})
        @DisplayName("human decisions are terminal")
        void terminal(ApplicationStatus status) {
            assertThat(status.isTerminal()).isTrue();
            assertThat(status.canTransitionTo(ApplicationStatus.EVALUATING)).isFalse();
        }

        @Test
        @DisplayName("only approved statuses count as funded")
        void funded() {
            assertThat(ApplicationStatus.APPROVED.isFunded()).isTrue();
            assertThat(ApplicationStatus.AUTO_APPROVED.isFunded()).isTrue();
            assertThat(ApplicationStatus.NEEDS_REVIEW.isFunded()).isFalse();
            assertThat(ApplicationStatus.REJECTED.isFunded()).isFalse();
        }
    }

    @Nested
    @DisplayName("Application.withStatus")
    class WithStatus {

        @Test
        void returnsCopyWithNewStatus() {
            Application pending = CouncilFixtures.application();

            Application evaluating = pending.withStatus(ApplicationStatus.EVALUATING);

            assertThat(evaluating.status()).isEqualTo(ApplicationStatus.EVALUATING);
            assertThat(pending.status()).isEqualTo(ApplicationStatus.PENDING);
            assertThat(evaluating.title()).isEqualTo(pending.title());
        }

        @Test
        void rejectsIllegalMove() {
            Application pending = CouncilFixtures.application();

            assertThatThrownBy(() -> pending.withStatus(ApplicationStatus.APPROVED))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("cannot move from pending to approved");
        }
    }

    @Test
    @DisplayName("lowercase wire values round into the enum")
    void wireValues() {
        assertThat(ApplicationStatus.NEEDS_REVIEW.value()).isEqualTo("needs_review");
        assertThat(ApplicationStatus.fromValue("auto_approved")).isEqualTo(ApplicationStatus.AUTO_APPROVED);
        assertThat(Recommendation.fromValue("Needs Review")).isEqualTo(Recommendation.NEEDS_REVIEW);
        assertThatThrownBy(() -> Recommendation.fromValue("maybe"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
