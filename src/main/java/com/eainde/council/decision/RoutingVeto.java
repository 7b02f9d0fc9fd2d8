package com.eainde.council.decision;

import com.eainde.council.model.Application;

import java.util.Optional;

/**
 * Domain override applied after the routing rules. A veto can only send an auto-executed result to human
 * review; it is never consulted for results that already need review.
 */
public interface RoutingVeto {

    /**
     * @return the reason to force review, or empty to let the result stand
     */
    Optional<String> veto(Application application, AggregateStats stats, RoutingResult result);
}
