package com.eainde.council.decision;

import com.eainde.council.agent.ApplicationFormatter;
import com.eainde.council.config.CouncilProperties;
import com.eainde.council.model.Application;
import com.eainde.council.model.Recommendation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps aggregated statistics to a routing decision. First matching rule wins:
 * <ol>
 *   <li>auto-approve: unanimous approve, average score ≥ auto-approve threshold, average confidence ≥
 *       confidence threshold, funding below the budget review threshold;</li>
 *   <li>auto-reject: unanimous reject, average score ≤ auto-reject threshold, average confidence ≥
 *       confidence threshold;</li>
 *   <li>otherwise human review, listing every failed condition.</li>
 * </ol>
 * Vetoes run afterwards and may only turn an auto-executed result into review.
 */
@Slf4j
@Component
public class Router {

    static final String NOT_UNANIMOUS = "evaluators did not reach unanimous recommendation";
    static final String ALL_REQUESTED_REVIEW = "all evaluators recommended human review";

    private static final double EPSILON = 1e-9;

    private final CouncilProperties.Thresholds thresholds;
    private final List<RoutingVeto> vetoes;

    @Autowired
    public Router(CouncilProperties properties, ObjectProvider<RoutingVeto> vetoes) {
        this(properties.getThresholds(), vetoes.orderedStream().collect(Collectors.toList()));
    }

    public Router(CouncilProperties.Thresholds thresholds, List<RoutingVeto> vetoes) {
        this.thresholds = thresholds;
        this.vetoes = List.copyOf(vetoes);
    }

    public RoutingResult route(Application application, AggregateStats stats) {
        RoutingResult result = applyRules(application, stats);
        for (RoutingVeto veto : vetoes) {
            if (!result.autoExecuted()) {
                break;
            }
            Optional<String> reason = veto.veto(application, stats, result);
            if (reason.isPresent()) {
                log.info("Routing veto {} sent application {} to review: {}",
                        veto.getClass().getSimpleName(), application.id(), reason.get());
                result = result.vetoed(reason.get());
            }
        }
        log.info("Application {} routed: recommendation={} auto={} reasons={}",
                application.id(), result.recommendation().value(), result.autoExecuted(), result.reviewReasons());
        return result;
    }

    private RoutingResult applyRules(Application application, AggregateStats stats) {
        boolean scoreHighEnough = stats.averageScore() + EPSILON >= thresholds.getAutoApprove();
        boolean scoreLowEnough = stats.averageScore() - EPSILON <= thresholds.getAutoReject();
        boolean confident = stats.averageConfidence() + EPSILON >= thresholds.getConfidence();
        boolean withinBudget = application.fundingRequested() < thresholds.getBudgetReview();

        if (stats.unanimouslyRecommends(Recommendation.APPROVE) && scoreHighEnough && confident && withinBudget) {
            return new RoutingResult(Recommendation.APPROVE, true, List.of());
        }
        if (stats.unanimouslyRecommends(Recommendation.REJECT) && scoreLowEnough && confident) {
            return new RoutingResult(Recommendation.REJECT, true, List.of());
        }

        List<String> reasons = new ArrayList<>();
        Recommendation direction;
        if (stats.unanimouslyRecommends(Recommendation.APPROVE)) {
            direction = Recommendation.APPROVE;
            if (!scoreHighEnough) {
                reasons.add(String.format(Locale.US, "average score (%.2f) below auto-approve threshold (%.2f)",
                        stats.averageScore(), thresholds.getAutoApprove()));
            }
            addConfidenceReason(reasons, stats, confident);
            addBudgetReason(reasons, application, withinBudget);
        } else if (stats.unanimouslyRecommends(Recommendation.REJECT)) {
            direction = Recommendation.REJECT;
            if (!scoreLowEnough) {
                reasons.add(String.format(Locale.US, "average score (%.2f) above auto-reject threshold (%.2f)",
                        stats.averageScore(), thresholds.getAutoReject()));
            }
            addConfidenceReason(reasons, stats, confident);
        } else {
            direction = Recommendation.NEEDS_REVIEW;
            reasons.add(stats.unanimous() ? ALL_REQUESTED_REVIEW : NOT_UNANIMOUS);
            addConfidenceReason(reasons, stats, confident);
            addBudgetReason(reasons, application, withinBudget);
        }
        return new RoutingResult(direction, false, reasons);
    }

    private void addConfidenceReason(List<String> reasons, AggregateStats stats, boolean confident) {
        if (!confident) {
            reasons.add(String.format(Locale.US, "average confidence (%.2f) below auto-execute threshold (%.2f)",
                    stats.averageConfidence(), thresholds.getConfidence()));
        }
    }

    private void addBudgetReason(List<String> reasons, Application application, boolean withinBudget) {
        if (!withinBudget) {
            String requested = ApplicationFormatter.amount(application.fundingRequested(), application.currency());
            if (!requested.startsWith("$")) {
                // the threshold is in USD and amounts are compared without conversion
                requested += ", compared as USD";
            }
            reasons.add("funding requested (" + requested + ") exceeds budget review threshold ("
                    + ApplicationFormatter.usd(thresholds.getBudgetReview()) + ")");
        }
    }
}
