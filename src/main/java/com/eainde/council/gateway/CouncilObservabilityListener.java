package com.eainde.council.gateway;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logs latency and token usage of every model call, tagged with the agent from the MDC.
 */
public class CouncilObservabilityListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(CouncilObservabilityListener.class);
    private static final String START_TIME = "council.startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
        log.debug("Sending {} messages to model {} (agent={})",
                requestContext.chatRequest().messages().size(),
                requestContext.chatRequest().parameters().modelName(),
                MDC.get("agentId"));
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        long duration = elapsed(responseContext.attributes().get(START_TIME));
        TokenUsage usage = responseContext.chatResponse().tokenUsage();

        if (usage != null) {
            log.info("Model {} responded in {}ms (agent={}, tokens in={}, out={}, total={})",
                    responseContext.chatRequest().parameters().modelName(),
                    duration,
                    MDC.get("agentId"),
                    usage.inputTokenCount(),
                    usage.outputTokenCount(),
                    usage.totalTokenCount());
        } else {
            log.info("Model {} responded in {}ms (agent={})",
                    responseContext.chatRequest().parameters().modelName(), duration, MDC.get("agentId"));
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.warn("Model call failed after {}ms (agent={}): {}",
                elapsed(errorContext.attributes().get(START_TIME)),
                MDC.get("agentId"),
                errorContext.error().getMessage());
    }

    private static long elapsed(Object startTime) {
        return startTime instanceof Long start ? System.currentTimeMillis() - start : -1L;
    }
}
