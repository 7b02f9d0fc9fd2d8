package com.eainde.council.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;

/**
 * {@link InferenceGateway} on top of a LangChain4j {@link ChatModel}.
 * <p>
 * The model id travels with each request, so one client serves every agent in the roster. Provider
 * exceptions are folded into {@link GatewayException} kinds; structured calls are parsed and checked for
 * the schema's required fields before being returned.
 * </p>
 */
@Slf4j
@Component
public class LangChainInferenceGateway implements InferenceGateway {

    private final ChatModel chatModel;
    private final ChatRequestFactory requestFactory;
    private final ObjectMapper objectMapper;

    public LangChainInferenceGateway(ChatModel chatModel, ChatRequestFactory requestFactory, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.requestFactory = requestFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public String complete(String model, List<ChatMessage> messages, double temperature) {
        return send(requestFactory.toRequest(model, messages, temperature, null));
    }

    @Override
    public JsonNode invoke(String model, List<ChatMessage> messages, double temperature, CouncilSchema schema) {
        String text = send(requestFactory.toRequest(model, messages, temperature, schema));
        return parse(text, schema);
    }

    JsonNode parse(String text, CouncilSchema schema) {
        JsonNode node;
        try {
            node = objectMapper.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("Model output for " + schema.schemaName() + " is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new SchemaViolationException("Model output for " + schema.schemaName() + " is not a JSON object");
        }
        for (String field : schema.requiredFields()) {
            if (!node.hasNonNull(field)) {
                throw new SchemaViolationException(
                        "Model output for " + schema.schemaName() + " is missing required field '" + field + "'");
            }
        }
        return node;
    }

    private String send(ChatRequest request) {
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (TimeoutException e) {
            throw new GatewayException(GatewayException.Kind.TIMEOUT, "Model call timed out: " + e.getMessage(), e);
        } catch (RateLimitException e) {
            throw new GatewayException(GatewayException.Kind.RATE_LIMITED, "Model call rate limited: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (hasTimeoutCause(e)) {
                throw new GatewayException(GatewayException.Kind.TIMEOUT, "Model call timed out: " + e.getMessage(), e);
            }
            throw new GatewayException(GatewayException.Kind.UNAVAILABLE, "Model call failed: " + e.getMessage(), e);
        }

        AiMessage message = response != null ? response.aiMessage() : null;
        if (message == null || message.text() == null || message.text().isBlank()) {
            throw new GatewayException(GatewayException.Kind.INVALID_RESPONSE, "Model returned an empty response");
        }
        log.debug("Model {} answered with {} characters", request.parameters().modelName(), message.text().length());
        return message.text();
    }

    private static boolean hasTimeoutCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    /** Some providers wrap JSON in a markdown fence even in JSON mode. */
    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
