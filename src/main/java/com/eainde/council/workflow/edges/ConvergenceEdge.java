package com.eainde.council.workflow.edges;

import com.eainde.council.deliberation.DeliberationCoordinator;
import com.eainde.council.workflow.state.CouncilState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Decides after initial evaluation and after every round whether to deliberate again. Ends deliberation
 * when a round produced no significant revision or the round limit is reached.
 */
@Component
@RequiredArgsConstructor
public class ConvergenceEdge implements AsyncEdgeAction<CouncilState> {

    public static final String DELIBERATE = "deliberate";
    public static final String AGGREGATE = "aggregate";

    private final DeliberationCoordinator coordinator;

    @Override
    public CompletableFuture<String> apply(CouncilState state) {
        String next = coordinator.shouldContinue(state.getRoundsCompleted(), state.getLastRound())
                ? DELIBERATE
                : AGGREGATE;
        return CompletableFuture.completedFuture(next);
    }
}
