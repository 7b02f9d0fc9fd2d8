package com.eainde.council.deliberation;

import com.eainde.council.agent.AgentDescriptor;
import com.eainde.council.agent.ApplicationFormatter;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class DeliberationPromptBuilder {

    private final ApplicationFormatter formatter;

    public List<ChatMessage> deliberationPrompt(AgentDescriptor agent,
                                                Application application,
                                                AgentEvaluation own,
                                                List<AnonymizedPeer> peers,
                                                int round) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Council Deliberation, Round ").append(round).append("\n\n");

        sb.append("# Application\n");
        sb.append(formatter.format(application)).append("\n\n");

        sb.append("# Your Current Position\n");
        if (own.degraded()) {
            sb.append("Your earlier evaluation could not be obtained. Give a complete evaluation now, "
                    + "taking your colleagues' views into account.\n\n");
        } else {
            sb.append(String.format(Locale.US, "Score: %.2f | Recommendation: %s | Confidence: %.2f%n",
                    own.score(), own.recommendation().value(), own.confidence()));
            sb.append("Rationale: ").append(own.rationale()).append('\n');
            appendList(sb, "Strengths", own.strengths());
            appendList(sb, "Concerns", own.concerns());
            sb.append('\n');
        }

        sb.append("# Other Reviewers\n");
        if (peers.isEmpty()) {
            sb.append("No other reviewer produced a usable evaluation.\n\n");
        }
        for (AnonymizedPeer peer : peers) {
            sb.append("## ").append(peer.label()).append('\n');
            sb.append(String.format(Locale.US, "Score: %.2f | Recommendation: %s | Confidence: %.2f%n",
                    peer.score(), peer.recommendation().value(), peer.confidence()));
            sb.append("Rationale: ").append(peer.rationale()).append('\n');
            appendList(sb, "Strengths", peer.strengths());
            appendList(sb, "Concerns", peer.concerns());
            sb.append('\n');
        }

        sb.append("# Your Task\n");
        sb.append("""
                Weigh the other reviewers' arguments against your own. Change your position only if they raise
                something you missed or misjudged; agreeing for its own sake is not useful to the council.

                Respond with a JSON object:
                - revised: true if your position changed
                - score, recommendation, confidence, rationale, strengths, concerns, questions: your (possibly unchanged) evaluation
                - revision_rationale: what in the other reviews moved you, or why it did not""");

        return List.of(SystemMessage.from(agent.getPersona()), UserMessage.from(sb.toString()));
    }

    private static void appendList(StringBuilder sb, String heading, List<String> items) {
        if (!items.isEmpty()) {
            sb.append(heading).append(": ").append(String.join("; ", items)).append('\n');
        }
    }
}
