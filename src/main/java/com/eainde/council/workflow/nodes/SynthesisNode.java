package com.eainde.council.workflow.nodes;

import com.eainde.council.events.CouncilEvent;
import com.eainde.council.synthesis.SynthesisResult;
import com.eainde.council.synthesis.Synthesizer;
import com.eainde.council.workflow.RunContextRegistry;
import com.eainde.council.workflow.state.CouncilState;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class SynthesisNode implements AsyncNodeAction<CouncilState> {

    private final Synthesizer synthesizer;
    private final RunContextRegistry runs;

    @Override
    public CompletableFuture<Map<String, Object>> apply(CouncilState state) {
        runs.emit(state.getRunId(), CouncilEvent.started(CouncilEvent.SYNTHESIS));

        SynthesisResult result = synthesizer.synthesize(
                state.getApplication(), state.getCurrent(), state.getStats(), state.getRouting());

        runs.emit(state.getRunId(), CouncilEvent.completed(CouncilEvent.SYNTHESIS,
                Map.of("fallback", result.fallback())));
        return CompletableFuture.completedFuture(Map.of(CouncilState.SYNTHESIS, result));
    }
}
