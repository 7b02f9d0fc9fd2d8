package com.eainde.council.learning;

import com.eainde.council.CouncilFixtures;
import com.eainde.council.agent.AgentRoster;
import com.eainde.council.agent.ApplicationFormatter;
import com.eainde.council.agent.DomainTagger;
import com.eainde.council.config.CouncilProperties;
import com.eainde.council.gateway.CouncilSchema;
import com.eainde.council.gateway.GatewayException;
import com.eainde.council.gateway.InferenceGateway;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.CouncilDecision;
import com.eainde.council.model.HumanDecision;
import com.eainde.council.model.Observation;
import com.eainde.council.model.ObservationSource;
import com.eainde.council.model.ObservationStatus;
import com.eainde.council.model.Outcome;
import com.eainde.council.model.OutcomeResult;
import com.eainde.council.model.Recommendation;
import com.eainde.council.store.EntityKind;
import com.eainde.council.store.InMemoryCouncilStore;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.eainde.council.CouncilFixtures.NOW;
import static com.eainde.council.CouncilFixtures.evaluation;
import static com.eainde.council.CouncilFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LearningLoopTest {

    private static final JsonNode TWO_OBSERVATIONS = json("""
            {"observations": [
              {"pattern": "Check indexer hosting costs against the budget.", "tags": ["Budget", "infra"], "confidence": 1.4},
              {"pattern": "Ask for prior rollup deployments.", "tags": [], "confidence": 0.6},
              {"pattern": "   ", "tags": ["ignored"]}
            ]}""");

    @Mock
    private InferenceGateway gateway;
    private InMemoryCouncilStore store;
    private ObservationService observations;
    private LearningLoop loop;

    @BeforeEach
    void setUp() {
        store = new InMemoryCouncilStore();
        loop = loopOver(store);
    }

    private LearningLoop loopOver(InMemoryCouncilStore councilStore) {
        CouncilProperties properties = new CouncilProperties();
        properties.getLearning().setMaxObservationsPerReflection(3);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        observations = new ObservationService(councilStore, clock, 5);
        return new LearningLoop(gateway,
                new AgentRoster(CouncilFixtures.roster()),
                observations,
                new DomainTagger(Map.of("infrastructure", List.of("indexer"))),
                new ReflectionPrompts(new ApplicationFormatter()),
                Runnable::run,
                clock,
                properties);
    }

    private static String personaOf(List<ChatMessage> messages) {
        return ((SystemMessage) messages.get(0)).text();
    }

    @Nested
    @DisplayName("onOverride")
    class Override {

        private final CouncilDecision decision = CouncilDecision.builder()
                .id("decision-1")
                .applicationId("app-1")
                .evaluations(List.of(
                        evaluation("technical", 0.8, Recommendation.APPROVE, 0.9),
                        evaluation("ecosystem", 0.2, Recommendation.REJECT, 0.9),
                        evaluation("budget", 0.5, Recommendation.NEEDS_REVIEW, 0.0).toBuilder().degraded(true).build(),
                        evaluation("impact", 0.7, Recommendation.APPROVE, 0.8)))
                .recommendation(Recommendation.NEEDS_REVIEW)
                .build();
        private final HumanDecision human =
                new HumanDecision(Recommendation.REJECT, "Team lacks operations experience.", "alice", NOW, true);

        @Test
        @DisplayName("only agents that disagreed with the human reflect")
        void disagreeingAgentsOnly() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION)))
                    .thenReturn(TWO_OBSERVATIONS);

            List<Observation> created = loop.onOverride(CouncilFixtures.application(), decision, human);

            verify(gateway, times(2)).invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION));
            assertThat(created).hasSize(4);
            assertThat(created).extracting(Observation::agentId)
                    .containsExactly("technical", "technical", "impact", "impact");
            assertThat(created).allSatisfy(o -> {
                assertThat(o.status()).isEqualTo(ObservationStatus.DRAFT);
                assertThat(o.source()).isEqualTo(ObservationSource.OVERRIDE);
                assertThat(o.evidence()).containsExactly("app-1");
                assertThat(o.tags()).contains("infrastructure");
            });
            assertThat(observations.list(null, ObservationStatus.DRAFT)).hasSize(4);
        }

        @Test
        @DisplayName("a failing reflection is skipped without affecting the others")
        void failureSkipped() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION)))
                    .thenAnswer(invocation -> {
                        List<ChatMessage> messages = invocation.getArgument(1);
                        if (personaOf(messages).contains("technical")) {
                            throw new GatewayException(GatewayException.Kind.TIMEOUT, "slow");
                        }
                        return TWO_OBSERVATIONS;
                    });

            List<Observation> created = loop.onOverride(CouncilFixtures.application(), decision, human);

            assertThat(created).extracting(Observation::agentId).containsOnly("impact");
        }

        @Test
        @DisplayName("a storage failure while saving one agent's observations does not stop the other agents")
        void storageFailureSkipped() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION)))
                    .thenReturn(TWO_OBSERVATIONS);
            InMemoryCouncilStore failingForTechnical = new InMemoryCouncilStore() {
                @java.lang.Override
                public <T> void put(EntityKind kind, String id, T record) {
                    if (record instanceof Observation o && o.agentId().equals("technical")) {
                        throw new UncheckedIOException(new IOException("disk full"));
                    }
                    super.put(kind, id, record);
                }
            };

            List<Observation> created = loopOver(failingForTechnical)
                    .onOverride(CouncilFixtures.application(), decision, human);

            assertThat(created).extracting(Observation::agentId).containsExactly("impact", "impact");
            assertThat(failingForTechnical.list(EntityKind.OBSERVATION, Observation.class)).hasSize(2);
        }

        @Test
        void asyncVariantCompletes() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION)))
                    .thenReturn(TWO_OBSERVATIONS);

            assertThat(loop.onOverrideAsync(CouncilFixtures.application(), decision, human).join()).hasSize(4);
        }
    }

    @Nested
    @DisplayName("onOutcome")
    class OnOutcome {

        @Test
        @DisplayName("every agent reflects when no decision is on record")
        void allAgentsWithoutDecision() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION)))
                    .thenReturn(TWO_OBSERVATIONS);
            Outcome outcome = new Outcome("app-1", OutcomeResult.FAILURE, "Missed the second milestone.", NOW);

            List<Observation> created = loop.onOutcome(CouncilFixtures.application(), null, outcome);

            assertThat(created).hasSize(8);
            assertThat(created).allSatisfy(o -> assertThat(o.source()).isEqualTo(ObservationSource.OUTCOME));
        }

        @Test
        @DisplayName("the outcome prompt carries the result and the notes")
        void promptContent() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION)))
                    .thenAnswer(invocation -> {
                        List<ChatMessage> messages = invocation.getArgument(1);
                        String user = ((UserMessage) messages.get(1)).singleText();
                        assertThat(user).contains("FAILURE").contains("Missed the second milestone.");
                        return json("{\"observations\": []}");
                    });

            loop.onOutcome(CouncilFixtures.application(), null,
                    new Outcome("app-1", OutcomeResult.FAILURE, "Missed the second milestone.", NOW));

            verify(gateway, times(4)).invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION));
        }
    }

    @Nested
    @DisplayName("bootstrap")
    class Bootstrap {

        @Test
        @DisplayName("stops once every agent reaches the target")
        void reachesTarget() {
            when(gateway.invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION)))
                    .thenReturn(TWO_OBSERVATIONS);
            List<HistoricalCase> cases = List.of(
                    new HistoricalCase(CouncilFixtures.application("hist-1", 10_000), OutcomeResult.SUCCESS, null),
                    new HistoricalCase(CouncilFixtures.application("hist-2", 20_000), OutcomeResult.FAILURE, "Abandoned."));

            Map<String, List<Observation>> created = loop.bootstrap(cases, 2);

            assertThat(created).containsOnlyKeys("technical", "ecosystem", "budget", "impact");
            assertThat(created.values()).allSatisfy(list -> {
                assertThat(list).hasSize(2);
                assertThat(list).allSatisfy(o -> {
                    assertThat(o.source()).isEqualTo(ObservationSource.BOOTSTRAP);
                    assertThat(o.evidence()).containsExactly("hist-1");
                });
            });
            verify(gateway, times(4)).invoke(anyString(), anyList(), anyDouble(), eq(CouncilSchema.REFLECTION));
        }

        @Test
        void rejectsNonPositiveTarget() {
            assertThatThrownBy(() -> loop.bootstrap(List.of(), 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("model tags are lowercased and confidence is clamped")
    void toObservationNormalizes() {
        Observation observation = LearningLoop.toObservation(TWO_OBSERVATIONS.path("observations").get(0),
                CouncilFixtures.agent("budget", "budget"), CouncilFixtures.application(),
                Set.of("infrastructure"), ObservationSource.OUTCOME, NOW);

        assertThat(observation.tags()).containsExactly("budget", "infra", "infrastructure");
        assertThat(observation.confidence()).isEqualTo(1.0);
        assertThat(observation.createdAt()).isEqualTo(NOW);
        assertThat(LearningLoop.toObservation(TWO_OBSERVATIONS.path("observations").get(2),
                CouncilFixtures.agent("budget"), CouncilFixtures.application(),
                Set.of(), ObservationSource.OUTCOME, NOW)).isNull();
    }

    @Test
    void pruneDelegatesToStaleFlagging() {
        assertThat(loop.prune()).isEmpty();
    }
}
