package com.eainde.council.workflow;

import com.eainde.council.deliberation.DeliberationCoordinator;
import com.eainde.council.deliberation.RoundResult;
import com.eainde.council.decision.AggregateStats;
import com.eainde.council.decision.RoutingResult;
import com.eainde.council.events.CouncilEvent;
import com.eainde.council.events.EventSink;
import com.eainde.council.learning.LearningLoop;
import com.eainde.council.model.Application;
import com.eainde.council.model.ApplicationStatus;
import com.eainde.council.model.CouncilDecision;
import com.eainde.council.model.HumanDecision;
import com.eainde.council.model.Outcome;
import com.eainde.council.model.OutcomeResult;
import com.eainde.council.model.Recommendation;
import com.eainde.council.store.CouncilStore;
import com.eainde.council.store.EntityKind;
import com.eainde.council.synthesis.SynthesisResult;
import com.eainde.council.team.TeamRegistry;
import com.eainde.council.workflow.state.CouncilState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point of the council. Drives one evaluation run through the {@code councilWorkflow} graph,
 * persists its single {@link CouncilDecision}, and records the human decisions and outcomes that follow.
 *
 * <p>Only this class emits the boundary events of a run: {@code parsing}, the terminal {@code complete}
 * and {@code error}. Stage events come from the graph nodes through {@link RunContextRegistry}.
 */
@Log4j2
@Service
public class CouncilEngine {

    static final int MIN_OUTCOME_NOTES = 10;

    private final CompiledGraph<CouncilState> councilWorkflow;
    private final RunContextRegistry runs;
    private final ApplicationLifecycle lifecycle;
    private final CouncilStore store;
    private final TeamRegistry teamRegistry;
    private final LearningLoop learningLoop;
    private final DeliberationCoordinator coordinator;
    private final Executor pipelineExecutor;
    private final Clock clock;

    public CouncilEngine(@Qualifier("councilWorkflow") CompiledGraph<CouncilState> councilWorkflow,
                         RunContextRegistry runs,
                         ApplicationLifecycle lifecycle,
                         CouncilStore store,
                         TeamRegistry teamRegistry,
                         LearningLoop learningLoop,
                         DeliberationCoordinator coordinator,
                         @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                         Clock clock) {
        this.councilWorkflow = councilWorkflow;
        this.runs = runs;
        this.lifecycle = lifecycle;
        this.store = store;
        this.teamRegistry = teamRegistry;
        this.learningLoop = learningLoop;
        this.coordinator = coordinator;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    /**
     * Parses a submission and evaluates it.
     *
     * @param parser produces the application; returning null or throwing aborts the run before any evaluation
     * @throws PipelineAbortException when no application could be produced
     */
    public CouncilDecision evaluateSubmission(Supplier<Application> parser, EventSink sink) {
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        runs.open(runId, sink);
        try {
            runs.emit(runId, CouncilEvent.started(CouncilEvent.PARSING));
            Application application;
            try {
                application = parser.get();
            } catch (RuntimeException e) {
                throw abort(runId, "Application could not be parsed: " + e.getMessage(), e);
            }
            if (application == null) {
                throw abort(runId, "Application could not be parsed: no application was produced", null);
            }
            store.put(EntityKind.APPLICATION, application.id(), application);
            runs.emit(runId, CouncilEvent.completed(CouncilEvent.PARSING, Map.of("application_id", application.id())));
            return run(runId, application);
        } finally {
            runs.close(runId);
            MDC.remove("runId");
        }
    }

    /**
     * Evaluates a stored application: initial evaluation, deliberation, aggregation, routing and synthesis.
     * Re-evaluating an application replaces its previous decision.
     *
     * @throws PipelineAbortException when the application is unknown or its status forbids evaluation
     */
    public CouncilDecision evaluate(String applicationId, EventSink sink) {
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        runs.open(runId, sink);
        try {
            Application application = store.get(EntityKind.APPLICATION, applicationId, Application.class)
                    .orElseThrow(() -> abort(runId, "Unknown application: " + applicationId, null));
            return run(runId, application);
        } finally {
            runs.close(runId);
            MDC.remove("runId");
        }
    }

    /**
     * Same as {@link #evaluate} on the pipeline executor. Cancelling the future does not stop inference
     * calls already in flight; the run still persists its decision.
     */
    public CompletableFuture<CouncilDecision> evaluateAsync(String applicationId, EventSink sink) {
        return CompletableFuture.supplyAsync(() -> evaluate(applicationId, sink), pipelineExecutor);
    }

    private CouncilDecision run(String runId, Application application) {
        MDC.put("applicationId", application.id());
        try {
            Application evaluating;
            try {
                evaluating = lifecycle.transition(application, ApplicationStatus.EVALUATING);
            } catch (IllegalStateException e) {
                throw abort(runId, e.getMessage(), e);
            }
            log.info("Council run {} started for application {}", runId, application.id());

            CouncilState state;
            try {
                state = councilWorkflow.invoke(Map.of(
                                CouncilState.RUN_ID, runId,
                                CouncilState.APPLICATION, evaluating))
                        .orElseThrow(() -> new IllegalStateException("council workflow produced no final state"));
            } catch (RuntimeException e) {
                String message = rootMessage(e);
                log.error("Council run {} for application {} failed: {}", runId, application.id(), message, e);
                runs.emit(runId, CouncilEvent.error(message));
                throw e;
            }

            CouncilDecision decision = toDecision(state);
            store.put(EntityKind.DECISION, decision.applicationId(), decision);
            lifecycle.transition(state.getApplication(), state.getRouting().targetStatus());
            teamRegistry.register(state.getApplication());

            log.info("Council run {} for application {} finished: {} (auto={}, rounds={})", runId,
                    application.id(), decision.recommendation().value(), decision.autoExecuted(),
                    decision.deliberationRounds());
            runs.emit(runId, CouncilEvent.finished(completionPayload(decision)));
            return decision;
        } finally {
            MDC.remove("applicationId");
        }
    }

    /**
     * Records a reviewer's final decision. A decision that differs from the council's recommendation counts
     * as an override and starts learning in the background.
     *
     * @param decision {@link Recommendation#APPROVE} or {@link Recommendation#REJECT}
     * @throws IllegalArgumentException for any other decision, or an unknown application
     * @throws IllegalStateException when the application is not waiting for a human decision
     */
    public CouncilDecision recordHumanDecision(String applicationId, Recommendation decision,
                                               String rationale, String reviewer) {
        if (decision != Recommendation.APPROVE && decision != Recommendation.REJECT) {
            throw new IllegalArgumentException("A human decision must be approve or reject");
        }
        Application application = requireApplication(applicationId);
        if (!application.status().isAwaitingHumanDecision()) {
            throw new IllegalStateException("Application " + applicationId + " is "
                    + application.status().value() + " and not awaiting a human decision");
        }
        CouncilDecision council = store.get(EntityKind.DECISION, applicationId, CouncilDecision.class)
                .orElseThrow(() -> new IllegalStateException("No council decision for application " + applicationId));

        boolean override = decision != council.recommendation();
        HumanDecision human = new HumanDecision(decision, rationale, reviewer, clock.instant(), override);
        CouncilDecision updated = council.withHumanDecision(human);
        store.put(EntityKind.DECISION, applicationId, updated);
        Application decided = lifecycle.transition(application,
                decision == Recommendation.APPROVE ? ApplicationStatus.APPROVED : ApplicationStatus.REJECTED);

        log.info("Reviewer {} decided {} on application {} (override={})",
                reviewer, decision.value(), applicationId, override);
        if (override) {
            learningLoop.onOverrideAsync(decided, updated, human);
        }
        return updated;
    }

    /**
     * Records how a funded application turned out, updates its team's record and starts outcome learning
     * in the background.
     *
     * @throws IllegalArgumentException for notes shorter than 10 characters, or an unknown application
     * @throws IllegalStateException when the application was never funded or already has an outcome
     */
    public Outcome recordOutcome(String applicationId, OutcomeResult result, String notes) {
        if (notes == null || notes.trim().length() < MIN_OUTCOME_NOTES) {
            throw new IllegalArgumentException("Outcome notes must be at least " + MIN_OUTCOME_NOTES + " characters");
        }
        Application application = requireApplication(applicationId);
        if (!application.status().isFunded()) {
            throw new IllegalStateException("Application " + applicationId + " is "
                    + application.status().value() + "; outcomes apply to funded applications only");
        }
        // team counters and learning are applied once per application
        store.get(EntityKind.OUTCOME, applicationId, Outcome.class).ifPresent(existing -> {
            throw new IllegalStateException("Application " + applicationId + " already has outcome "
                    + existing.result().value() + " recorded at " + existing.recordedAt());
        });
        Outcome outcome = new Outcome(applicationId, result, notes.trim(), clock.instant());
        store.put(EntityKind.OUTCOME, applicationId, outcome);
        teamRegistry.recordOutcome(application, result);

        CouncilDecision decision = store.get(EntityKind.DECISION, applicationId, CouncilDecision.class).orElse(null);
        log.info("Outcome {} recorded for application {}", result.value(), applicationId);
        learningLoop.onOutcomeAsync(application, decision, outcome);
        return outcome;
    }

    private Application requireApplication(String applicationId) {
        return store.get(EntityKind.APPLICATION, applicationId, Application.class)
                .orElseThrow(() -> new IllegalArgumentException("Unknown application: " + applicationId));
    }

    private CouncilDecision toDecision(CouncilState state) {
        AggregateStats stats = state.getStats();
        RoutingResult routing = state.getRouting();
        SynthesisResult synthesis = state.getSynthesis();
        RoundResult lastRound = state.getLastRound();
        int rounds = state.getRoundsCompleted();
        boolean stoppedEarly = lastRound != null && lastRound.converged() && rounds < coordinator.maxRounds();

        return CouncilDecision.builder()
                .id(UUID.randomUUID().toString())
                .applicationId(state.getApplication().id())
                .evaluations(state.getCurrent())
                .history(state.getHistory())
                .averageScore(stats.averageScore())
                .averageConfidence(stats.averageConfidence())
                .scoreVariance(stats.scoreVariance())
                .recommendation(routing.recommendation())
                .autoExecuted(routing.autoExecuted())
                .requiresHumanReview(routing.requiresHumanReview())
                .reviewReasons(routing.reviewReasons())
                .synthesis(synthesis.synthesis())
                .applicantFeedback(synthesis.applicantFeedback())
                .deliberationRounds(rounds)
                .stoppedEarly(stoppedEarly)
                .createdAt(clock.instant())
                .build();
    }

    private static Map<String, Object> completionPayload(CouncilDecision decision) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recommendation", decision.recommendation().value());
        payload.put("synthesis", decision.synthesis());
        payload.put("feedback", decision.applicantFeedback());
        payload.put("average_score", decision.averageScore());
        payload.put("decision_id", decision.id());
        payload.put("application_id", decision.applicationId());
        return payload;
    }

    private PipelineAbortException abort(String runId, String message, Throwable cause) {
        log.warn("Council run {} refused to start: {}", runId, message);
        runs.emit(runId, CouncilEvent.error(message));
        return cause != null ? new PipelineAbortException(message, cause) : new PipelineAbortException(message);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
