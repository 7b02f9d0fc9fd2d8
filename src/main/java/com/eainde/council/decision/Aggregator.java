package com.eainde.council.decision;

import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Recommendation;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reduces the final evaluations (one per agent) to summary statistics. Pure and deterministic.
 */
@Component
public class Aggregator {

    /**
     * @throws IllegalArgumentException for an empty set; the pipeline always has one evaluation per agent
     */
    public AggregateStats aggregate(List<AgentEvaluation> evaluations) {
        if (evaluations == null || evaluations.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty evaluation set");
        }

        int n = evaluations.size();
        double scoreSum = 0;
        double confidenceSum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (AgentEvaluation e : evaluations) {
            scoreSum += e.score();
            confidenceSum += e.confidence();
            min = Math.min(min, e.score());
            max = Math.max(max, e.score());
        }
        // clamp against floating-point drift so the mean never leaves [min, max]
        double mean = Math.min(max, Math.max(min, scoreSum / n));
        double averageConfidence = confidenceSum / n;

        double squaredDeviation = 0;
        for (AgentEvaluation e : evaluations) {
            double d = e.score() - mean;
            squaredDeviation += d * d;
        }
        double variance = squaredDeviation / n;

        Recommendation first = evaluations.get(0).recommendation();
        boolean unanimous = evaluations.stream().allMatch(e -> e.recommendation() == first);

        return new AggregateStats(n, mean, averageConfidence, variance, min, max,
                unanimous, unanimous ? first : null);
    }
}
