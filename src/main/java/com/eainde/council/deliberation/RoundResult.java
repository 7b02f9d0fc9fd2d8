package com.eainde.council.deliberation;

import com.eainde.council.model.AgentEvaluation;

import java.io.Serializable;
import java.util.List;

/**
 * @param current   the latest evaluation per agent after the round, in roster order
 * @param revisions evaluations newly recorded in this round (significant revisions only)
 * @param failures  agents whose revision call failed and who kept their previous evaluation
 */
public record RoundResult(int round, List<AgentEvaluation> current, List<AgentEvaluation> revisions, int failures)
        implements Serializable {

    public RoundResult {
        current = List.copyOf(current);
        revisions = List.copyOf(revisions);
    }

    public boolean converged() {
        return revisions.isEmpty();
    }
}
