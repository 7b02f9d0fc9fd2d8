package com.eainde.council.agent;

import com.eainde.council.config.CouncilProperties;
import com.eainde.council.gateway.CouncilSchema;
import com.eainde.council.gateway.GatewayException;
import com.eainde.council.gateway.InferenceGateway;
import dev.langchain4j.data.message.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sends one agent prompt and validates the answer, repeating the identical prompt when the call fails
 * or the answer breaks the contract. Shared by initial evaluation and deliberation.
 */
@Slf4j
@Component
public class AgentCaller {

    private final InferenceGateway gateway;
    private final EvaluationParser parser;
    private final int maxAttempts;

    @Autowired
    public AgentCaller(InferenceGateway gateway, EvaluationParser parser, CouncilProperties properties) {
        this(gateway, parser, properties.getEvaluation().getMaxAttempts());
    }

    public AgentCaller(InferenceGateway gateway, EvaluationParser parser, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.gateway = gateway;
        this.parser = parser;
        this.maxAttempts = maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @throws GatewayException the last failure once every attempt has failed
     */
    public EvaluationDraft call(AgentDescriptor agent, List<ChatMessage> messages, CouncilSchema schema, double temperature) {
        GatewayException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("agentId", agent.getId())) {
                return parser.parse(gateway.invoke(agent.getModel(), messages, temperature, schema));
            } catch (GatewayException e) {
                last = e;
                log.warn("Agent {} attempt {}/{} failed [{}]: {}",
                        agent.getId(), attempt, maxAttempts, e.getKind(), e.getMessage());
            }
        }
        throw last;
    }
}
