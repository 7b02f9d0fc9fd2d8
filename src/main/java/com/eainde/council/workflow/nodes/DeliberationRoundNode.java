package com.eainde.council.workflow.nodes;

import com.eainde.council.deliberation.DeliberationCoordinator;
import com.eainde.council.deliberation.RoundResult;
import com.eainde.council.events.CouncilEvent;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.workflow.RunContextRegistry;
import com.eainde.council.workflow.state.CouncilState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Runs the next deliberation round; the graph loops back here while the convergence edge says so. */
@Component
@RequiredArgsConstructor
public class DeliberationRoundNode implements AsyncNodeAction<CouncilState> {

    private final DeliberationCoordinator coordinator;
    private final RunContextRegistry runs;

    @Override
    public CompletableFuture<Map<String, Object>> apply(CouncilState state) {
        int round = state.getRoundsCompleted() + 1;
        String stage = CouncilEvent.deliberationRound(round);
        runs.emit(state.getRunId(), CouncilEvent.started(stage));

        RoundResult result = coordinator.runRound(state.getApplication(), state.getCurrent(), round);

        List<AgentEvaluation> history = new ArrayList<>(state.getHistory());
        history.addAll(result.revisions());
        runs.emit(state.getRunId(), CouncilEvent.completed(stage, Map.of(
                "revisions", result.revisions().size(),
                "failures", result.failures(),
                "converged", result.converged())));

        return CompletableFuture.completedFuture(Map.of(
                CouncilState.CURRENT, result.current(),
                CouncilState.HISTORY, List.copyOf(history),
                CouncilState.ROUNDS_COMPLETED, round,
                CouncilState.LAST_ROUND, result));
    }
}
