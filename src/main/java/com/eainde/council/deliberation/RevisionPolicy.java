package com.eainde.council.deliberation;

import com.eainde.council.agent.EvaluationDraft;
import com.eainde.council.config.CouncilProperties;
import com.eainde.council.model.AgentEvaluation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides whether a deliberation answer is a real change of position: the score moved by at least the
 * position-change threshold, or the recommendation flipped. Rewording alone is not a revision.
 * Any usable answer replaces a degraded placeholder, since the placeholder holds no position.
 */
@Component
public class RevisionPolicy {

    // absorbs binary rounding, e.g. 0.85 - 0.70 = 0.1499999...
    private static final double EPSILON = 1e-9;

    private final double positionChangeThreshold;

    @Autowired
    public RevisionPolicy(CouncilProperties properties) {
        this(properties.getThresholds().getPositionChange());
    }

    public RevisionPolicy(double positionChangeThreshold) {
        this.positionChangeThreshold = positionChangeThreshold;
    }

    public boolean isSignificant(AgentEvaluation prior, EvaluationDraft revised) {
        if (prior.degraded()) {
            return true;
        }
        boolean scoreMoved = Math.abs(revised.score() - prior.score()) + EPSILON >= positionChangeThreshold;
        boolean recommendationChanged = revised.recommendation() != prior.recommendation();
        return scoreMoved || recommendationChanged;
    }

    public double threshold() {
        return positionChangeThreshold;
    }
}
