package com.eainde.council.workflow.nodes;

import com.eainde.council.decision.AggregateStats;
import com.eainde.council.decision.Aggregator;
import com.eainde.council.decision.Router;
import com.eainde.council.decision.RoutingResult;
import com.eainde.council.events.CouncilEvent;
import com.eainde.council.workflow.RunContextRegistry;
import com.eainde.council.workflow.state.CouncilState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Combines the final evaluations and decides whether a human has to look. */
@Component
@RequiredArgsConstructor
public class AggregationNode implements AsyncNodeAction<CouncilState> {

    private final Aggregator aggregator;
    private final Router router;
    private final RunContextRegistry runs;

    @Override
    public CompletableFuture<Map<String, Object>> apply(CouncilState state) {
        runs.emit(state.getRunId(), CouncilEvent.started(CouncilEvent.AGGREGATION));

        AggregateStats stats = aggregator.aggregate(state.getCurrent());
        RoutingResult routing = router.route(state.getApplication(), stats);

        runs.emit(state.getRunId(), CouncilEvent.completed(CouncilEvent.AGGREGATION, Map.of(
                "average_score", stats.averageScore(),
                "average_confidence", stats.averageConfidence(),
                "recommendation", routing.recommendation().value(),
                "auto_executed", routing.autoExecuted(),
                "review_reasons", routing.reviewReasons())));

        return CompletableFuture.completedFuture(Map.of(
                CouncilState.STATS, stats,
                CouncilState.ROUTING, routing));
    }
}
