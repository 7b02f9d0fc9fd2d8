package com.eainde.council.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.message.ChatMessage;

import java.util.List;

/**
 * The language-model service as the council sees it: a prompt in, text or a schema-shaped value out.
 * Implementations throw {@link GatewayException} for every failure and never retry on their own.
 */
public interface InferenceGateway {

    String complete(String model, List<ChatMessage> messages, double temperature);

    /**
     * @return a JSON object carrying at least the schema's required fields
     * @throws SchemaViolationException when the output is not such an object
     */
    JsonNode invoke(String model, List<ChatMessage> messages, double temperature, CouncilSchema schema);
}
