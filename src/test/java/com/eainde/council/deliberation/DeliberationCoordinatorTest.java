package com.eainde.council.deliberation;

import com.eainde.council.CouncilFixtures;
import com.eainde.council.agent.AgentCaller;
import com.eainde.council.agent.AgentRoster;
import com.eainde.council.agent.ApplicationFormatter;
import com.eainde.council.agent.EvaluationParser;
import com.eainde.council.config.CouncilProperties;
import com.eainde.council.gateway.CouncilSchema;
import com.eainde.council.gateway.GatewayException;
import com.eainde.council.gateway.InferenceGateway;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Recommendation;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.eainde.council.CouncilFixtures.evaluation;
import static com.eainde.council.CouncilFixtures.evaluationJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeliberationCoordinatorTest {

    private final InferenceGateway gateway = mock(InferenceGateway.class);
    private final Clock clock = Clock.fixed(CouncilFixtures.NOW, ZoneOffset.UTC);
    private DeliberationCoordinator coordinator;

    private final List<AgentEvaluation> initial = List.of(
            evaluation("technical", 0.70, Recommendation.APPROVE, 0.8),
            evaluation("ecosystem", 0.40, Recommendation.REJECT, 0.7),
            evaluation("budget", 0.60, Recommendation.NEEDS_REVIEW, 0.6),
            evaluation("impact", 0.80, Recommendation.APPROVE, 0.8));

    @BeforeEach
    void setUp() {
        coordinator = coordinator(2);
    }

    private DeliberationCoordinator coordinator(int maxRounds) {
        CouncilProperties properties = new CouncilProperties();
        properties.getDeliberation().setMaxRounds(maxRounds);
        ApplicationFormatter formatter = new ApplicationFormatter();
        return new DeliberationCoordinator(
                new AgentRoster(CouncilFixtures.roster()),
                new PeerAnonymizer(),
                new DeliberationPromptBuilder(formatter),
                new AgentCaller(gateway, new EvaluationParser(), 2),
                new RevisionPolicy(0.15),
                Runnable::run,
                clock,
                properties);
    }

    private void answer(String agentId, Object response) {
        var stub = when(gateway.invoke(anyString(),
                argThat((List<ChatMessage> messages) -> messages != null
                        && ((SystemMessage) messages.get(0)).text().contains(" " + agentId + " ")),
                anyDouble(), eq(CouncilSchema.DELIBERATION)));
        if (response instanceof RuntimeException e) {
            stub.thenThrow(e);
        } else {
            stub.thenReturn((JsonNode) response);
        }
    }

    @Nested
    @DisplayName("runRound")
    class RunRound {

        @Test
        @DisplayName("only significant changes become new evaluations carrying the prior position")
        void recordsSignificantRevisions() {
            answer("technical", evaluationJson(0.75, "approve", 0.8));      // small move, held
            answer("ecosystem", evaluationJson(0.65, "needs_review", 0.7)); // flipped
            answer("budget", evaluationJson(0.60, "needs_review", 0.6));    // unchanged
            answer("impact", evaluationJson(0.80, "approve", 0.9));         // unchanged

            RoundResult result = coordinator.runRound(CouncilFixtures.application(), initial, 1);

            assertThat(result.round()).isEqualTo(1);
            assertThat(result.converged()).isFalse();
            assertThat(result.revisions()).hasSize(1);
            AgentEvaluation revised = result.revisions().get(0);
            assertThat(revised.agentId()).isEqualTo("ecosystem");
            assertThat(revised.round()).isEqualTo(1);
            assertThat(revised.priorScore()).isEqualTo(0.40);
            assertThat(revised.priorRecommendation()).isEqualTo(Recommendation.REJECT);
            assertThat(revised.recommendation()).isEqualTo(Recommendation.NEEDS_REVIEW);
            assertThat(revised.revisionRationale()).isEqualTo("Peers raised nothing new.");
            assertThat(revised.isRevision()).isTrue();

            assertThat(result.current()).extracting(AgentEvaluation::agentId)
                    .containsExactly("technical", "ecosystem", "budget", "impact");
            assertThat(result.current().get(0)).isSameAs(initial.get(0));
            assertThat(result.current().get(1)).isSameAs(revised);
        }

        @Test
        @DisplayName("a failed revision call keeps the previous evaluation")
        void failureKeepsPrior() {
            answer("technical", new GatewayException(GatewayException.Kind.UNAVAILABLE, "down"));
            answer("ecosystem", evaluationJson(0.40, "reject", 0.7));
            answer("budget", evaluationJson(0.60, "needs_review", 0.6));
            answer("impact", evaluationJson(0.80, "approve", 0.8));

            RoundResult result = coordinator.runRound(CouncilFixtures.application(), initial, 1);

            assertThat(result.failures()).isEqualTo(1);
            assertThat(result.converged()).isTrue();
            assertThat(result.current()).containsExactlyElementsOf(initial);
        }

        @Test
        @DisplayName("peer prompts never reveal agent ids")
        void promptsAreAnonymized() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), any())).thenAnswer(invocation -> {
                List<ChatMessage> messages = invocation.getArgument(1);
                String user = ((UserMessage) messages.get(1)).singleText();
                String peers = user.substring(user.indexOf("# Other Reviewers"));
                assertThat(peers).contains("Reviewer ").doesNotContain("technical agent").doesNotContain("eval-");
                return evaluationJson(0.5, "needs_review", 0.5);
            });

            coordinator.runRound(CouncilFixtures.application(), initial, 1);
        }
    }

    @Nested
    @DisplayName("shouldContinue")
    class ShouldContinue {

        @Test
        void firstRoundRunsWhenRoundsAllowed() {
            assertThat(coordinator.shouldContinue(0, null)).isTrue();
        }

        @Test
        void convergedRoundStops() {
            RoundResult converged = new RoundResult(1, initial, List.of(), 0);

            assertThat(coordinator.shouldContinue(1, converged)).isFalse();
        }

        @Test
        void revisedRoundContinuesUntilLimit() {
            RoundResult revised = new RoundResult(1, initial, List.of(initial.get(0)), 0);

            assertThat(coordinator.shouldContinue(1, revised)).isTrue();
            assertThat(coordinator.shouldContinue(2, revised)).isFalse();
        }

        @Test
        void zeroRoundsSkipsDeliberation() {
            assertThat(coordinator(0).shouldContinue(0, null)).isFalse();
        }

        @Test
        void negativeRoundLimitIsRejected() {
            assertThatThrownBy(() -> coordinator(-1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a round limit the council graph cannot run to is refused at startup")
        void roundLimitBeyondGraphStepsIsRejected() {
            assertThat(coordinator(DeliberationCoordinator.MAX_ROUNDS_LIMIT).maxRounds()).isEqualTo(20);
            assertThatThrownBy(() -> coordinator(DeliberationCoordinator.MAX_ROUNDS_LIMIT + 1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("between 0 and 20");
        }
    }
}
