package com.eainde.council.agent;

import com.eainde.council.model.Application;
import com.eainde.council.model.Observation;
import com.eainde.council.model.TeamProfile;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds the initial-evaluation prompt: the persona as system message, then one user message with
 * learned patterns, team history, comparable applications, the application and the output contract.
 */
@Component
@RequiredArgsConstructor
public class AgentPromptBuilder {

    static final String BUDGET_TAG = "budget";

    private final ApplicationFormatter formatter;

    public List<ChatMessage> evaluationPrompt(AgentDescriptor agent,
                                              Application application,
                                              List<Observation> observations,
                                              EvaluationContext context) {
        StringBuilder sb = new StringBuilder();

        if (!observations.isEmpty()) {
            sb.append("# Patterns You've Learned\n");
            sb.append("From earlier reviews you have observed:\n");
            for (Observation observation : observations) {
                sb.append("- ").append(observation.pattern())
                        .append(String.format(Locale.US, " (confidence: %.0f%%)", observation.confidence() * 100))
                        .append('\n');
            }
            sb.append('\n');
        }

        TeamProfile team = context.team();
        long previousApplications = team == null ? 0
                : team.applicationIds().stream().filter(id -> !id.equals(application.id())).count();
        if (previousApplications > 0) {
            sb.append("# Team History\n");
            sb.append("This team (").append(team.canonicalName()).append(") has applied before:\n");
            sb.append("- Previous applications: ").append(previousApplications).append('\n');
            sb.append("- Successful grants: ").append(team.successfulGrants()).append('\n');
            sb.append("- Failed grants: ").append(team.failedGrants()).append('\n');
            if (team.totalFunded() > 0) {
                sb.append("- Total previously funded: ").append(ApplicationFormatter.usd(team.totalFunded())).append('\n');
            }
            sb.append('\n');
        }

        if (!context.comparableApplications().isEmpty()) {
            sb.append("# Similar Past Applications\n");
            context.comparableApplications().stream().limit(3).forEach(similar ->
                    sb.append("- ").append(similar.title()).append(": ").append(similar.status().value()).append('\n'));
            sb.append('\n');
        }

        sb.append("# Application to Evaluate\n");
        sb.append(formatter.format(application)).append("\n\n");

        if (agent.hasTag(BUDGET_TAG)) {
            List<String> signals = formatter.inputQualitySignals(application);
            if (!signals.isEmpty()) {
                sb.append("# Input Quality Signals\n");
                signals.forEach(s -> sb.append("- ").append(s).append('\n'));
                sb.append('\n');
            }
        }

        sb.append("# Your Evaluation\n");
        sb.append("""
                Respond with a JSON object:
                - score: number 0-1 (0 = strong reject, 0.5 = uncertain, 1 = strong approve)
                - recommendation: "approve" | "reject" | "needs_review"
                - confidence: number 0-1, how sure you are of this assessment
                - rationale: two or three paragraphs of reasoning
                - strengths: specific positives you found
                - concerns: specific issues or red flags
                - questions: what you would ask the team before deciding

                Reference concrete details from the application.""");

        return List.of(SystemMessage.from(agent.getPersona()), UserMessage.from(sb.toString()));
    }
}
