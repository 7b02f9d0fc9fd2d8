package com.eainde.council.deliberation;

import com.eainde.council.agent.AgentCaller;
import com.eainde.council.agent.AgentDescriptor;
import com.eainde.council.agent.AgentRoster;
import com.eainde.council.agent.EvaluationDraft;
import com.eainde.council.config.CouncilProperties;
import com.eainde.council.gateway.CouncilSchema;
import com.eainde.council.gateway.GatewayException;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import dev.langchain4j.data.message.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs deliberation rounds. Within a round every agent is re-queried concurrently with an anonymized view
 * of its peers; the round settles when all calls have. Rounds themselves are driven one at a time by the
 * caller, because round N+1 prompts are built from round N results.
 */
@Slf4j
@Service
public class DeliberationCoordinator {

    /**
     * The compiled council graph stops after 25 steps (langgraph4j's default iteration limit). The entry and
     * exit steps, initial evaluation, aggregation and synthesis take five of them; each round takes one.
     */
    static final int MAX_ROUNDS_LIMIT = 25 - 5;

    private final AgentRoster roster;
    private final PeerAnonymizer anonymizer;
    private final DeliberationPromptBuilder promptBuilder;
    private final AgentCaller agentCaller;
    private final RevisionPolicy revisionPolicy;
    private final Executor inferenceExecutor;
    private final Clock clock;
    private final int maxRounds;
    private final double temperature;

    public DeliberationCoordinator(AgentRoster roster,
                                   PeerAnonymizer anonymizer,
                                   DeliberationPromptBuilder promptBuilder,
                                   AgentCaller agentCaller,
                                   RevisionPolicy revisionPolicy,
                                   @Qualifier("inferenceExecutor") Executor inferenceExecutor,
                                   Clock clock,
                                   CouncilProperties properties) {
        int configuredRounds = properties.getDeliberation().getMaxRounds();
        if (configuredRounds < 0 || configuredRounds > MAX_ROUNDS_LIMIT) {
            throw new IllegalArgumentException("council.deliberation.max-rounds must be between 0 and "
                    + MAX_ROUNDS_LIMIT + ", was " + configuredRounds);
        }
        this.roster = roster;
        this.anonymizer = anonymizer;
        this.promptBuilder = promptBuilder;
        this.agentCaller = agentCaller;
        this.revisionPolicy = revisionPolicy;
        this.inferenceExecutor = inferenceExecutor;
        this.clock = clock;
        this.maxRounds = properties.getDeliberation().getMaxRounds();
        this.temperature = properties.getDeliberation().getTemperature();
    }

    public int maxRounds() {
        return maxRounds;
    }

    /**
     * Whether another round should run after {@code roundsCompleted} rounds. A round without a single
     * significant revision ends deliberation; so does reaching the round limit.
     */
    public boolean shouldContinue(int roundsCompleted, RoundResult lastRound) {
        if (roundsCompleted >= maxRounds) {
            return false;
        }
        return lastRound == null || !lastRound.converged();
    }

    /**
     * @param current latest evaluation per agent, in roster order
     * @param round   1-based round number
     */
    public RoundResult runRound(Application application, List<AgentEvaluation> current, int round) {
        log.info("Deliberation round {} for application {} ({} agents)", round, application.id(), current.size());

        List<CompletableFuture<RevisionOutcome>> futures = new ArrayList<>();
        for (AgentEvaluation prior : current) {
            Optional<AgentDescriptor> agent = roster.find(prior.agentId());
            if (agent.isEmpty()) {
                log.warn("Agent {} is no longer in the roster; keeping its evaluation unchanged", prior.agentId());
                futures.add(CompletableFuture.completedFuture(RevisionOutcome.HELD));
                continue;
            }
            List<AnonymizedPeer> peers = anonymizer.peersFor(prior.agentId(), current, application.id(), round);
            List<ChatMessage> prompt =
                    promptBuilder.deliberationPrompt(agent.get(), application, prior, peers, round);
            futures.add(CompletableFuture.supplyAsync(
                    () -> revise(agent.get(), prior, prompt, round), inferenceExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<AgentEvaluation> next = new ArrayList<>(current.size());
        List<AgentEvaluation> revisions = new ArrayList<>();
        int failures = 0;
        for (int i = 0; i < current.size(); i++) {
            RevisionOutcome outcome = futures.get(i).join();
            if (outcome.failed()) {
                failures++;
                next.add(current.get(i));
            } else if (outcome.revised() != null) {
                revisions.add(outcome.revised());
                next.add(outcome.revised());
            } else {
                next.add(current.get(i));
            }
        }

        log.info("Round {} for application {} settled: {} revisions, {} failed calls",
                round, application.id(), revisions.size(), failures);
        return new RoundResult(round, next, revisions, failures);
    }

    private RevisionOutcome revise(AgentDescriptor agent, AgentEvaluation prior,
                                   List<ChatMessage> prompt, int round) {
        EvaluationDraft draft;
        try {
            draft = agentCaller.call(agent, prompt, CouncilSchema.DELIBERATION, agent.temperatureOr(temperature));
        } catch (GatewayException e) {
            log.warn("Agent {} could not deliberate in round {}; keeping its previous evaluation", agent.getId(), round);
            return RevisionOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Unexpected error while agent {} deliberated in round {}", agent.getId(), round, e);
            return RevisionOutcome.FAILED;
        }

        if (!revisionPolicy.isSignificant(prior, draft)) {
            log.debug("Agent {} held position in round {} ({} -> {})",
                    agent.getId(), round, prior.score(), draft.score());
            return RevisionOutcome.HELD;
        }

        log.info("Agent {} revised in round {}: {} {} -> {} {}", agent.getId(), round,
                prior.recommendation().value(), prior.score(), draft.recommendation().value(), draft.score());
        return new RevisionOutcome(prior.toBuilder()
                .id(UUID.randomUUID().toString())
                .score(draft.score())
                .recommendation(draft.recommendation())
                .confidence(draft.confidence())
                .rationale(draft.rationale())
                .strengths(draft.strengths())
                .concerns(draft.concerns())
                .questions(draft.questions())
                .round(round)
                .priorScore(prior.degraded() ? null : prior.score())
                .priorRecommendation(prior.degraded() ? null : prior.recommendation())
                .revisionRationale(draft.revisionRationale())
                .degraded(false)
                .createdAt(clock.instant())
                .build(), false);
    }

    /** Result of one agent's revision call: a new evaluation, a held position, or a failed call. */
    private record RevisionOutcome(AgentEvaluation revised, boolean failed) {
        static final RevisionOutcome HELD = new RevisionOutcome(null, false);
        static final RevisionOutcome FAILED = new RevisionOutcome(null, true);
    }
}
