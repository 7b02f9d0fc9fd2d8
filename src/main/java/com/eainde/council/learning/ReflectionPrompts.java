package com.eainde.council.learning;

import com.eainde.council.agent.AgentDescriptor;
import com.eainde.council.agent.ApplicationFormatter;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import com.eainde.council.model.HumanDecision;
import com.eainde.council.model.Outcome;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Prompts that ask an agent to turn a human override or a real-world outcome into reusable patterns.
 */
@Component
@RequiredArgsConstructor
public class ReflectionPrompts {

    private static final String OUTPUT_CONTRACT = """
            Respond with a JSON object {"observations": [...]} holding at most %d entries, each with:
            - pattern: one specific, actionable statement that would improve similar future evaluations
            - tags: short lowercase topic tags (for example "budget", "defi", "timeline")
            - confidence: number 0-1""";

    private final ApplicationFormatter formatter;

    public List<ChatMessage> override(AgentDescriptor agent, Application application, AgentEvaluation evaluation,
                                      HumanDecision decision, int maxObservations) {
        String body = "# Learning from an Override\n\n"
                + "A human reviewer did not follow your recommendation.\n\n"
                + "## Your Evaluation\n" + describe(evaluation) + "\n\n"
                + "## Human Decision\n"
                + "Decision: " + decision.decision().value() + "\n"
                + "Rationale: " + decision.rationale() + "\n\n"
                + "## Application Summary\n" + summary(application) + "\n\n"
                + "## Your Task\n"
                + "Reflect on the signal you may have missed or misweighted, given the reviewer's rationale.\n"
                + String.format(Locale.US, OUTPUT_CONTRACT, maxObservations);
        return List.of(SystemMessage.from(agent.getPersona()), UserMessage.from(body));
    }

    public List<ChatMessage> outcome(AgentDescriptor agent, Application application, AgentEvaluation evaluation,
                                     Outcome outcome, int maxObservations) {
        String body = "# Learning from an Outcome\n\n"
                + "This funded project has since been marked " + outcome.result().value().toUpperCase(Locale.ROOT) + ".\n"
                + "Outcome notes: " + outcome.notes() + "\n\n"
                + "## Your Evaluation\n"
                + (evaluation != null ? describe(evaluation) : "No evaluation of yours is on record for this application.")
                + "\n\n## Application\n" + formatter.format(application) + "\n\n"
                + "## Your Task\n"
                + "Decide whether the outcome corroborates or contradicts your assessment and what that teaches you "
                + "about applications like this one.\n"
                + String.format(Locale.US, OUTPUT_CONTRACT, maxObservations);
        return List.of(SystemMessage.from(agent.getPersona()), UserMessage.from(body));
    }

    private static String describe(AgentEvaluation evaluation) {
        return String.format(Locale.US, "Score: %.2f%nRecommendation: %s%nRationale: %s%nConcerns: %s",
                evaluation.score(), evaluation.recommendation().value(), evaluation.rationale(),
                evaluation.concerns().isEmpty() ? "none" : String.join("; ", evaluation.concerns()));
    }

    private static String summary(Application application) {
        return "Title: " + application.title() + "\n"
                + "Team: " + application.teamName() + "\n"
                + "Funding: " + ApplicationFormatter.amount(application.fundingRequested(), application.currency()) + "\n"
                + (application.summary() != null ? "Summary: " + application.summary() : "");
    }
}
