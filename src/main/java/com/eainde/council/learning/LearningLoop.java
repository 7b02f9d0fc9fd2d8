package com.eainde.council.learning;

import com.eainde.council.agent.AgentDescriptor;
import com.eainde.council.agent.AgentRoster;
import com.eainde.council.agent.DomainTagger;
import com.eainde.council.config.CouncilProperties;
import com.eainde.council.gateway.CouncilSchema;
import com.eainde.council.gateway.GatewayException;
import com.eainde.council.gateway.InferenceGateway;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import com.eainde.council.model.CouncilDecision;
import com.eainde.council.model.HumanDecision;
import com.eainde.council.model.Observation;
import com.eainde.council.model.ObservationSource;
import com.eainde.council.model.ObservationStatus;
import com.eainde.council.model.Outcome;
import com.eainde.council.model.OutcomeResult;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.message.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Turns human overrides and real-world outcomes into draft observations. Everything produced here starts
 * as {@link ObservationStatus#DRAFT} and reaches prompts only after a human activates it.
 *
 * <p>Learning is best effort: a reflection that fails for one agent is logged and skipped, and never
 * touches the decision or outcome that triggered it.
 */
@Slf4j
@Service
public class LearningLoop {

    private final InferenceGateway gateway;
    private final AgentRoster roster;
    private final ObservationService observations;
    private final DomainTagger domainTagger;
    private final ReflectionPrompts prompts;
    private final Executor pipelineExecutor;
    private final Clock clock;
    private final CouncilProperties.Learning settings;

    public LearningLoop(InferenceGateway gateway,
                        AgentRoster roster,
                        ObservationService observations,
                        DomainTagger domainTagger,
                        ReflectionPrompts prompts,
                        @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                        Clock clock,
                        CouncilProperties properties) {
        this.gateway = gateway;
        this.roster = roster;
        this.observations = observations;
        this.domainTagger = domainTagger;
        this.prompts = prompts;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
        this.settings = properties.getLearning();
    }

    /**
     * Asks every agent whose final recommendation differed from the human's to reflect on what it missed.
     * Agents that agreed with the human have nothing to learn from the override.
     */
    public List<Observation> onOverride(Application application, CouncilDecision decision, HumanDecision human) {
        List<Observation> created = new ArrayList<>();
        for (AgentEvaluation evaluation : decision.evaluations()) {
            if (evaluation.degraded() || evaluation.recommendation() == human.decision()) {
                continue;
            }
            AgentDescriptor agent = roster.find(evaluation.agentId()).orElse(null);
            if (agent == null) {
                log.warn("Skipping override reflection for unknown agent {}", evaluation.agentId());
                continue;
            }
            List<ChatMessage> prompt = prompts.override(agent, application, evaluation, human,
                    settings.getMaxObservationsPerReflection());
            created.addAll(reflect(agent, application, prompt, settings.getReflectionTemperature(),
                    ObservationSource.OVERRIDE, settings.getMaxObservationsPerReflection()));
        }
        log.info("Override on application {} produced {} draft observations", application.id(), created.size());
        return created;
    }

    /** Asks every agent that evaluated a funded application what its real-world outcome teaches. */
    public List<Observation> onOutcome(Application application, CouncilDecision decision, Outcome outcome) {
        Map<String, AgentEvaluation> byAgent = new LinkedHashMap<>();
        if (decision != null) {
            decision.evaluations().forEach(e -> byAgent.put(e.agentId(), e));
        }
        List<Observation> created = new ArrayList<>();
        for (AgentDescriptor agent : roster.agents()) {
            AgentEvaluation evaluation = byAgent.get(agent.getId());
            if (decision != null && evaluation == null) {
                continue;
            }
            List<ChatMessage> prompt = prompts.outcome(agent, application,
                    evaluation != null && !evaluation.degraded() ? evaluation : null,
                    outcome, settings.getMaxObservationsPerReflection());
            created.addAll(reflect(agent, application, prompt, settings.getReflectionTemperature(),
                    ObservationSource.OUTCOME, settings.getMaxObservationsPerReflection()));
        }
        log.info("Outcome {} on application {} produced {} draft observations",
                outcome.result().value(), application.id(), created.size());
        return created;
    }

    public CompletableFuture<List<Observation>> onOverrideAsync(Application application, CouncilDecision decision,
                                                                HumanDecision human) {
        return CompletableFuture.supplyAsync(() -> onOverride(application, decision, human), pipelineExecutor)
                .exceptionally(e -> {
                    log.error("Override learning failed for application {}", application.id(), e);
                    return List.of();
                });
    }

    public CompletableFuture<List<Observation>> onOutcomeAsync(Application application, CouncilDecision decision,
                                                               Outcome outcome) {
        return CompletableFuture.supplyAsync(() -> onOutcome(application, decision, outcome), pipelineExecutor)
                .exceptionally(e -> {
                    log.error("Outcome learning failed for application {}", application.id(), e);
                    return List.of();
                });
    }

    public Map<String, List<Observation>> bootstrap(List<HistoricalCase> cases) {
        return bootstrap(cases, settings.getBootstrapTarget());
    }

    /**
     * Seeds observations from historical cases, running the outcome reflection over each of them until
     * every agent holds {@code targetPerAgent} new drafts or the cases run out.
     *
     * @return new drafts per agent id, in roster order
     */
    public Map<String, List<Observation>> bootstrap(List<HistoricalCase> cases, int targetPerAgent) {
        if (targetPerAgent <= 0) {
            throw new IllegalArgumentException("targetPerAgent must be positive");
        }
        Map<String, List<Observation>> created = new LinkedHashMap<>();
        roster.agents().forEach(a -> created.put(a.getId(), new ArrayList<>()));

        for (HistoricalCase historical : cases) {
            if (created.values().stream().allMatch(list -> list.size() >= targetPerAgent)) {
                break;
            }
            Application application = historical.application();
            Outcome outcome = new Outcome(application.id(), historical.result(),
                    historical.notes() != null ? historical.notes() : describe(historical.result()), clock.instant());
            for (AgentDescriptor agent : roster.agents()) {
                List<Observation> mine = created.get(agent.getId());
                int remaining = targetPerAgent - mine.size();
                if (remaining <= 0) {
                    continue;
                }
                int limit = Math.min(remaining, settings.getMaxObservationsPerReflection());
                List<ChatMessage> prompt = prompts.outcome(agent, application, null, outcome, limit);
                mine.addAll(reflect(agent, application, prompt, settings.getBootstrapTemperature(),
                        ObservationSource.BOOTSTRAP, limit));
            }
        }
        created.forEach((agentId, list) -> log.info("Bootstrap produced {} draft observations for {}", list.size(), agentId));
        return created;
    }

    /** Flags active observations that were rarely used and are old. Nothing is deprecated automatically. */
    public List<Observation> prune() {
        List<Observation> flagged = observations.flagStale(settings.getMinEvidence(), settings.getMaxAgeDays());
        log.info("Prune flagged {} stale observations", flagged.size());
        return flagged;
    }

    private List<Observation> reflect(AgentDescriptor agent, Application application, List<ChatMessage> prompt,
                                      double temperature, ObservationSource source, int limit) {
        List<Observation> saved = new ArrayList<>();
        try {
            JsonNode response = gateway.invoke(agent.getModel(), prompt, temperature, CouncilSchema.REFLECTION);
            Set<String> domainTags = domainTagger.domainTags(application);
            Instant now = clock.instant();
            for (JsonNode node : response.path("observations")) {
                if (saved.size() >= limit) {
                    break;
                }
                Observation observation = toObservation(node, agent, application, domainTags, source, now);
                if (observation == null) {
                    log.debug("Dropping malformed observation from {}: {}", agent.getId(), node);
                    continue;
                }
                saved.add(observations.save(observation));
            }
        } catch (GatewayException e) {
            log.warn("Reflection by {} on application {} failed [{}]: {}",
                    agent.getId(), application.id(), e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Reflection by {} on application {} failed after saving {} observations",
                    agent.getId(), application.id(), saved.size(), e);
        }
        return saved;
    }

    static Observation toObservation(JsonNode node, AgentDescriptor agent, Application application,
                                     Set<String> domainTags, ObservationSource source, Instant now) {
        String pattern = node.path("pattern").asText("").trim();
        if (pattern.isEmpty()) {
            return null;
        }
        Set<String> tags = new LinkedHashSet<>();
        for (JsonNode tag : node.path("tags")) {
            String value = tag.asText("").trim().toLowerCase(Locale.ROOT);
            if (!value.isEmpty()) {
                tags.add(value);
            }
        }
        tags.addAll(domainTags);
        double confidence = node.path("confidence").isNumber() ? node.path("confidence").asDouble() : 0.5;
        return Observation.builder()
                .id(UUID.randomUUID().toString())
                .agentId(agent.getId())
                .pattern(pattern)
                .tags(List.copyOf(tags))
                .evidence(List.of(application.id()))
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .status(ObservationStatus.DRAFT)
                .source(source)
                .createdAt(now)
                .build();
    }

    private static String describe(OutcomeResult result) {
        return result == OutcomeResult.SUCCESS
                ? "The project delivered its milestones."
                : "The project did not deliver its milestones.";
    }
}
