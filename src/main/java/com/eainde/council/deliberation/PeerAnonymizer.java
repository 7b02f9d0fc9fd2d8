package com.eainde.council.deliberation;

import com.eainde.council.model.AgentEvaluation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Maps agent ids to neutral labels ("Reviewer A", "Reviewer B", ...) for one deliberation round.
 * <p>
 * The mapping is a pure function of (agent ids, application id, round): ids are sorted, then shuffled with
 * a seed derived from the application and the round. The same round always yields the same labels, while
 * a given agent does not keep a fixed letter across rounds or applications. Evaluations themselves are
 * never modified; only the prompt-facing view is anonymized.
 * </p>
 */
@Component
public class PeerAnonymizer {

    private static final String LABEL_PREFIX = "Reviewer ";

    public Map<String, String> labels(List<String> agentIds, String applicationId, int round) {
        List<String> order = new ArrayList<>(agentIds);
        Collections.sort(order);
        Collections.shuffle(order, new Random(Objects.hash(applicationId, round)));

        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            labels.put(order.get(i), LABEL_PREFIX + letter(i));
        }
        return labels;
    }

    /**
     * Peers of {@code selfAgentId} in label order. The agent's own evaluation and degraded placeholders are
     * left out.
     */
    public List<AnonymizedPeer> peersFor(String selfAgentId, List<AgentEvaluation> current,
                                         String applicationId, int round) {
        Map<String, String> labels = labels(
                current.stream().map(AgentEvaluation::agentId).collect(Collectors.toList()), applicationId, round);

        return current.stream()
                .filter(e -> !e.agentId().equals(selfAgentId))
                .filter(e -> !e.degraded())
                .map(e -> new AnonymizedPeer(labels.get(e.agentId()), e.score(), e.recommendation(),
                        e.confidence(), e.rationale(), e.strengths(), e.concerns()))
                .sorted(Comparator.comparing(AnonymizedPeer::label))
                .collect(Collectors.toList());
    }

    static String letter(int index) {
        return index < 26 ? String.valueOf((char) ('A' + index)) : String.valueOf(index + 1);
    }
}
