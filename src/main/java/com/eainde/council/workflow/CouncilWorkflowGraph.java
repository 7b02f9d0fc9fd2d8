package com.eainde.council.workflow;

import com.eainde.council.workflow.edges.ConvergenceEdge;
import com.eainde.council.workflow.nodes.AggregationNode;
import com.eainde.council.workflow.nodes.DeliberationRoundNode;
import com.eainde.council.workflow.nodes.InitialEvaluationNode;
import com.eainde.council.workflow.nodes.SynthesisNode;
import com.eainde.council.workflow.state.CouncilState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * initial_evaluation → deliberation_round* → aggregation → synthesis
 */
@Component
public class CouncilWorkflowGraph {

    static final String INITIAL_EVALUATION = "initial_evaluation";
    static final String DELIBERATION_ROUND = "deliberation_round";
    static final String AGGREGATION = "aggregation";
    static final String SYNTHESIS = "synthesis";

    private final InitialEvaluationNode initialEvaluationNode;
    private final DeliberationRoundNode deliberationRoundNode;
    private final AggregationNode aggregationNode;
    private final SynthesisNode synthesisNode;
    private final ConvergenceEdge convergenceEdge;

    public CouncilWorkflowGraph(InitialEvaluationNode initialEvaluationNode,
                                DeliberationRoundNode deliberationRoundNode,
                                AggregationNode aggregationNode,
                                SynthesisNode synthesisNode,
                                ConvergenceEdge convergenceEdge) {
        this.initialEvaluationNode = initialEvaluationNode;
        this.deliberationRoundNode = deliberationRoundNode;
        this.aggregationNode = aggregationNode;
        this.synthesisNode = synthesisNode;
        this.convergenceEdge = convergenceEdge;
    }

    @Bean("councilWorkflow")
    public CompiledGraph<CouncilState> build() throws GraphStateException {
        StateGraph<CouncilState> workflow = new StateGraph<>(CouncilState::new);

        workflow.addNode(INITIAL_EVALUATION, initialEvaluationNode);
        workflow.addNode(DELIBERATION_ROUND, deliberationRoundNode);
        workflow.addNode(AGGREGATION, aggregationNode);
        workflow.addNode(SYNTHESIS, synthesisNode);

        workflow.addEdge(START, INITIAL_EVALUATION);

        // the same decision follows initial evaluation and every round, so a limit of 0 rounds skips straight on
        Map<String, String> convergence = Map.of(
                ConvergenceEdge.DELIBERATE, DELIBERATION_ROUND,
                ConvergenceEdge.AGGREGATE, AGGREGATION);
        workflow.addConditionalEdges(INITIAL_EVALUATION, convergenceEdge, convergence);
        workflow.addConditionalEdges(DELIBERATION_ROUND, convergenceEdge, convergence);

        workflow.addEdge(AGGREGATION, SYNTHESIS);
        workflow.addEdge(SYNTHESIS, END);

        return workflow.compile();
    }
}
