package com.eainde.council.synthesis;

import com.eainde.council.agent.ApplicationFormatter;
import com.eainde.council.config.CouncilProperties;
import com.eainde.council.decision.AggregateStats;
import com.eainde.council.decision.RoutingResult;
import com.eainde.council.gateway.CouncilSchema;
import com.eainde.council.gateway.InferenceGateway;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Writes the internal synthesis and the applicant-facing feedback with one model call. Failure is never
 * fatal: a template built from the statistics and review reasons is returned instead.
 */
@Slf4j
@Service
public class Synthesizer {

    private static final String SYSTEM_PROMPT = """
            You are the chair of a grants council. You summarise the council's reviews for the program team
            and write feedback the applicant can act on. Be specific, fair and concise.""";

    private final InferenceGateway gateway;
    private final ApplicationFormatter formatter;
    private final String model;
    private final double temperature;

    public Synthesizer(InferenceGateway gateway, ApplicationFormatter formatter, CouncilProperties properties) {
        this.gateway = gateway;
        this.formatter = formatter;
        String configured = properties.getSynthesis().getModel();
        this.model = configured != null && !configured.isBlank() ? configured : properties.getModel().getDefaultModel();
        this.temperature = properties.getSynthesis().getTemperature();
    }

    public SynthesisResult synthesize(Application application,
                                      List<AgentEvaluation> evaluations,
                                      AggregateStats stats,
                                      RoutingResult routing) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("agentId", "synthesizer")) {
            JsonNode node = gateway.invoke(model, prompt(application, evaluations, stats, routing),
                    temperature, CouncilSchema.SYNTHESIS);
            String synthesis = node.path("synthesis").asText("");
            String feedback = node.path("applicant_feedback").asText("");
            if (synthesis.isBlank() || feedback.isBlank()) {
                throw new IllegalStateException("synthesis or applicant feedback is blank");
            }
            return new SynthesisResult(synthesis.trim(), feedback.trim(), false);
        } catch (RuntimeException e) {
            log.warn("Synthesis for application {} failed, using the template: {}", application.id(), e.getMessage());
            return fallback(evaluations, stats, routing);
        }
    }

    List<ChatMessage> prompt(Application application, List<AgentEvaluation> evaluations,
                             AggregateStats stats, RoutingResult routing) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Application\n").append(formatter.format(application)).append("\n\n");

        sb.append("# Council Evaluations\n");
        for (AgentEvaluation e : evaluations) {
            sb.append("## ").append(e.agentName()).append('\n');
            sb.append(String.format(Locale.US, "Score %.2f, %s, confidence %.2f%s%n",
                    e.score(), e.recommendation().value(), e.confidence(), e.degraded() ? " (unavailable)" : ""));
            sb.append(e.rationale()).append('\n');
            if (!e.strengths().isEmpty()) sb.append("Strengths: ").append(String.join("; ", e.strengths())).append('\n');
            if (!e.concerns().isEmpty()) sb.append("Concerns: ").append(String.join("; ", e.concerns())).append('\n');
            sb.append('\n');
        }

        sb.append("# Outcome\n");
        sb.append(String.format(Locale.US, "Average score %.2f, average confidence %.2f, variance %.3f, %s.%n",
                stats.averageScore(), stats.averageConfidence(), stats.scoreVariance(),
                stats.unanimous() ? "unanimous" : "split"));
        sb.append("Routing: ").append(routing.recommendation().value())
                .append(routing.autoExecuted() ? " (executed automatically)" : " (sent to human review)").append('\n');
        routing.reviewReasons().forEach(r -> sb.append("- ").append(r).append('\n'));

        sb.append("""

                Respond with a JSON object:
                - synthesis: where the council agreed and disagreed, and why the outcome was routed this way
                - applicant_feedback: constructive feedback for the applicant that references specific strengths and concerns""");

        return List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(sb.toString()));
    }

    SynthesisResult fallback(List<AgentEvaluation> evaluations, AggregateStats stats, RoutingResult routing) {
        StringBuilder synthesis = new StringBuilder();
        synthesis.append(String.format(Locale.US,
                "The council of %d reviewers gave an average score of %.2f with average confidence %.2f (%s). ",
                stats.evaluationCount(), stats.averageScore(), stats.averageConfidence(),
                stats.unanimous() ? "unanimous " + stats.unanimousRecommendation().value() : "recommendations were split"));
        synthesis.append("Outcome: ").append(routing.recommendation().value())
                .append(routing.autoExecuted() ? ", executed automatically." : ", pending human review.");
        if (!routing.reviewReasons().isEmpty()) {
            synthesis.append(" Review reasons: ").append(String.join("; ", routing.reviewReasons())).append('.');
        }

        Set<String> strengths = new LinkedHashSet<>();
        Set<String> concerns = new LinkedHashSet<>();
        for (AgentEvaluation e : evaluations) {
            strengths.addAll(e.strengths());
            concerns.addAll(e.concerns());
        }
        StringBuilder feedback = new StringBuilder("Thank you for your application. ");
        if (!strengths.isEmpty()) {
            feedback.append("Reviewers highlighted: ").append(String.join("; ", strengths.stream().limit(3).toList())).append(". ");
        }
        if (!concerns.isEmpty()) {
            feedback.append("Areas to strengthen: ").append(String.join("; ", concerns.stream().limit(3).toList())).append('.');
        }
        return new SynthesisResult(synthesis.toString().trim(), feedback.toString().trim(), true);
    }
}
