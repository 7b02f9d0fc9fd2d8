package com.eainde.council.decision;

import com.eainde.council.model.Recommendation;

import java.io.Serializable;

/**
 * Summary of a final evaluation set.
 *
 * @param scoreVariance             population variance of the scores
 * @param unanimousRecommendation   the shared recommendation when {@code unanimous}, otherwise null
 */
public record AggregateStats(
        int evaluationCount,
        double averageScore,
        double averageConfidence,
        double scoreVariance,
        double minScore,
        double maxScore,
        boolean unanimous,
        Recommendation unanimousRecommendation
) implements Serializable {

    public boolean unanimouslyRecommends(Recommendation recommendation) {
        return unanimous && unanimousRecommendation == recommendation;
    }
}
