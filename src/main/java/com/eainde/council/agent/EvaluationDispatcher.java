package com.eainde.council.agent;

import com.eainde.council.config.CouncilProperties;
import com.eainde.council.gateway.CouncilSchema;
import com.eainde.council.gateway.GatewayException;
import com.eainde.council.learning.ObservationService;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import com.eainde.council.model.Observation;
import com.eainde.council.model.Recommendation;
import dev.langchain4j.data.message.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Round-0 fan-out: one evaluation per configured agent, all issued concurrently.
 * <p>
 * The phase settles only when every agent has either answered, or failed twice and been replaced by a
 * degraded placeholder. One agent's failure never cancels or aborts its siblings. Results come back in
 * roster order.
 * </p>
 */
@Slf4j
@Service
public class EvaluationDispatcher {

    static final double DEGRADED_SCORE = 0.5;
    static final double DEGRADED_CONFIDENCE = 0.0;

    private final AgentRoster roster;
    private final AgentPromptBuilder promptBuilder;
    private final AgentCaller agentCaller;
    private final ObservationService observationService;
    private final DomainTagger domainTagger;
    private final Executor inferenceExecutor;
    private final Clock clock;
    private final double defaultTemperature;

    public EvaluationDispatcher(AgentRoster roster,
                                AgentPromptBuilder promptBuilder,
                                AgentCaller agentCaller,
                                ObservationService observationService,
                                DomainTagger domainTagger,
                                @Qualifier("inferenceExecutor") Executor inferenceExecutor,
                                Clock clock,
                                CouncilProperties properties) {
        this.roster = roster;
        this.promptBuilder = promptBuilder;
        this.agentCaller = agentCaller;
        this.observationService = observationService;
        this.domainTagger = domainTagger;
        this.inferenceExecutor = inferenceExecutor;
        this.clock = clock;
        this.defaultTemperature = properties.getEvaluation().getTemperature();
    }

    public List<AgentEvaluation> dispatch(Application application, EvaluationContext context) {
        log.info("Dispatching application {} to {} agents", application.id(), roster.size());

        List<CompletableFuture<AgentEvaluation>> futures = new ArrayList<>();
        for (AgentDescriptor agent : roster.agents()) {
            // retrieval updates usage counters, so it stays on the driver thread
            List<Observation> observations =
                    observationService.retrieveForPrompt(agent.getId(), domainTagger.retrievalTags(agent, application));
            List<ChatMessage> prompt = promptBuilder.evaluationPrompt(agent, application, observations, context);
            List<String> observationIds = observations.stream().map(Observation::id).toList();

            futures.add(CompletableFuture.supplyAsync(
                    () -> evaluate(agent, application, prompt, observationIds), inferenceExecutor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<AgentEvaluation> evaluations = futures.stream().map(CompletableFuture::join).toList();

        long degraded = evaluations.stream().filter(AgentEvaluation::degraded).count();
        log.info("Initial evaluation of {} settled: {} answered, {} degraded",
                application.id(), evaluations.size() - degraded, degraded);
        return evaluations;
    }

    private AgentEvaluation evaluate(AgentDescriptor agent, Application application,
                                     List<ChatMessage> prompt, List<String> observationIds) {
        try {
            EvaluationDraft draft = agentCaller.call(
                    agent, prompt, CouncilSchema.EVALUATION, agent.temperatureOr(defaultTemperature));
            return AgentEvaluation.builder()
                    .id(UUID.randomUUID().toString())
                    .applicationId(application.id())
                    .agentId(agent.getId())
                    .agentName(agent.getName())
                    .score(draft.score())
                    .recommendation(draft.recommendation())
                    .confidence(draft.confidence())
                    .rationale(draft.rationale())
                    .strengths(draft.strengths())
                    .concerns(draft.concerns())
                    .questions(draft.questions())
                    .round(0)
                    .observationIds(observationIds)
                    .createdAt(clock.instant())
                    .build();
        } catch (GatewayException e) {
            log.warn("Agent {} gave no usable evaluation for {}; recording a degraded evaluation",
                    agent.getId(), application.id());
            return degraded(agent, application, observationIds,
                    "failed after " + agentCaller.maxAttempts() + " attempts [" + e.getKind() + "]: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while evaluating {} with agent {}", application.id(), agent.getId(), e);
            return degraded(agent, application, observationIds, "unexpected error: " + e.getMessage());
        }
    }

    private AgentEvaluation degraded(AgentDescriptor agent, Application application,
                                     List<String> observationIds, String failure) {
        return AgentEvaluation.builder()
                .id(UUID.randomUUID().toString())
                .applicationId(application.id())
                .agentId(agent.getId())
                .agentName(agent.getName())
                .score(DEGRADED_SCORE)
                .recommendation(Recommendation.NEEDS_REVIEW)
                .confidence(DEGRADED_CONFIDENCE)
                .rationale("Evaluation unavailable: " + agent.getName() + " " + failure
                        + ". This neutral placeholder expresses no opinion and needs a human look.")
                .round(0)
                .observationIds(observationIds)
                .degraded(true)
                .createdAt(clock.instant())
                .build();
    }
}
