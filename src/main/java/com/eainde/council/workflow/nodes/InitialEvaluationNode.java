package com.eainde.council.workflow.nodes;

import com.eainde.council.agent.EvaluationContext;
import com.eainde.council.agent.EvaluationDispatcher;
import com.eainde.council.events.CouncilEvent;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import com.eainde.council.model.ApplicationStatus;
import com.eainde.council.team.TeamRegistry;
import com.eainde.council.workflow.ApplicationLifecycle;
import com.eainde.council.workflow.RunContextRegistry;
import com.eainde.council.workflow.state.CouncilState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class InitialEvaluationNode implements AsyncNodeAction<CouncilState> {

    private final EvaluationDispatcher dispatcher;
    private final TeamRegistry teamRegistry;
    private final ApplicationLifecycle lifecycle;
    private final RunContextRegistry runs;

    @Override
    public CompletableFuture<Map<String, Object>> apply(CouncilState state) {
        String runId = state.getRunId();
        Application application = state.getApplication();
        runs.emit(runId, CouncilEvent.started(CouncilEvent.INITIAL_EVALUATION));

        EvaluationContext context = teamRegistry.lookup(application)
                .map(EvaluationContext::forTeam)
                .orElseGet(EvaluationContext::empty);
        List<AgentEvaluation> evaluations = dispatcher.dispatch(application, context);
        long degraded = evaluations.stream().filter(AgentEvaluation::degraded).count();

        Application deliberating = lifecycle.transition(application, ApplicationStatus.DELIBERATING);
        runs.emit(runId, CouncilEvent.completed(CouncilEvent.INITIAL_EVALUATION,
                Map.of("evaluations", evaluations.size(), "degraded", degraded)));

        return CompletableFuture.completedFuture(Map.of(
                CouncilState.APPLICATION, deliberating,
                CouncilState.CURRENT, evaluations,
                CouncilState.HISTORY, evaluations,
                CouncilState.ROUNDS_COMPLETED, 0));
    }
}
