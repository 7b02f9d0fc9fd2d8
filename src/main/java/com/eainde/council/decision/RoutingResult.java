package com.eainde.council.decision;

import com.eainde.council.model.ApplicationStatus;
import com.eainde.council.model.Recommendation;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * @param recommendation the council's direction: APPROVE or REJECT when unanimous, otherwise NEEDS_REVIEW
 * @param autoExecuted   whether the pipeline may finalise without a human
 * @param reviewReasons  every failed auto-execute condition; empty iff auto-executed
 */
public record RoutingResult(Recommendation recommendation, boolean autoExecuted, List<String> reviewReasons)
        implements Serializable {

    public RoutingResult {
        reviewReasons = List.copyOf(reviewReasons);
    }

    public boolean requiresHumanReview() {
        return !autoExecuted;
    }

    /** Application status this routing result leads to. */
    public ApplicationStatus targetStatus() {
        if (autoExecuted && recommendation == Recommendation.APPROVE) {
            return ApplicationStatus.AUTO_APPROVED;
        }
        if (autoExecuted && recommendation == Recommendation.REJECT) {
            return ApplicationStatus.AUTO_REJECTED;
        }
        return ApplicationStatus.NEEDS_REVIEW;
    }

    /** Same direction, sent to a human for the given reason. */
    public RoutingResult vetoed(String reason) {
        List<String> reasons = new ArrayList<>(reviewReasons);
        reasons.add(reason);
        return new RoutingResult(recommendation, false, reasons);
    }
}
