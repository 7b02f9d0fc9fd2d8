package com.eainde.council.workflow.state;

import com.eainde.council.decision.AggregateStats;
import com.eainde.council.decision.RoutingResult;
import com.eainde.council.deliberation.RoundResult;
import com.eainde.council.model.AgentEvaluation;
import com.eainde.council.model.Application;
import com.eainde.council.synthesis.SynthesisResult;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;

/**
 * Graph state of one council run. Nodes return partial maps keyed by the constants below; each key is
 * overwritten by the latest node that sets it.
 */
public class CouncilState extends AgentState {

    public static final String RUN_ID = "run_id";
    public static final String APPLICATION = "application";
    /** Latest evaluation per agent, in roster order. */
    public static final String CURRENT = "current";
    /** Every evaluation recorded so far, in order. */
    public static final String HISTORY = "history";
    public static final String ROUNDS_COMPLETED = "rounds_completed";
    public static final String LAST_ROUND = "last_round";
    public static final String STATS = "stats";
    public static final String ROUTING = "routing";
    public static final String SYNTHESIS = "synthesis";

    public CouncilState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRunId() {
        return this.<String>value(RUN_ID).orElseThrow(() -> new IllegalStateException("run id missing from state"));
    }

    public Application getApplication() {
        return this.<Application>value(APPLICATION)
                .orElseThrow(() -> new IllegalStateException("application missing from state"));
    }

    public List<AgentEvaluation> getCurrent() {
        return this.<List<AgentEvaluation>>value(CURRENT).orElse(List.of());
    }

    public List<AgentEvaluation> getHistory() {
        return this.<List<AgentEvaluation>>value(HISTORY).orElse(List.of());
    }

    public int getRoundsCompleted() {
        return this.<Integer>value(ROUNDS_COMPLETED).orElse(0);
    }

    /** Result of the most recent deliberation round, null before the first one. */
    public RoundResult getLastRound() {
        return this.<RoundResult>value(LAST_ROUND).orElse(null);
    }

    public AggregateStats getStats() {
        return this.<AggregateStats>value(STATS).orElseThrow(() -> new IllegalStateException("aggregation has not run"));
    }

    public RoutingResult getRouting() {
        return this.<RoutingResult>value(ROUTING).orElseThrow(() -> new IllegalStateException("routing has not run"));
    }

    public SynthesisResult getSynthesis() {
        return this.<SynthesisResult>value(SYNTHESIS).orElseThrow(() -> new IllegalStateException("synthesis has not run"));
    }
}
