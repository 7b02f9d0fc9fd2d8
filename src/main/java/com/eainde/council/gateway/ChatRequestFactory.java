package com.eainde.council.gateway;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps a council call (model id, temperature, optional response schema) onto LangChain4j request parameters.
 */
@Component
public class ChatRequestFactory {

    public ChatRequest toRequest(String model, List<ChatMessage> messages, double temperature, CouncilSchema schema) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        return ChatRequest.builder()
                .messages(messages)
                .parameters(toRequestParameters(model, temperature, schema))
                .build();
    }

    public ChatRequestParameters toRequestParameters(String model, double temperature, CouncilSchema schema) {
        var builder = ChatRequestParameters.builder();

        if (model != null && !model.isBlank()) {
            builder.modelName(model);
        }
        builder.temperature(temperature);

        // JSON mode with the exact shape, when a schema is requested
        if (schema != null) {
            builder.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(schema.jsonSchema())
                    .build());
        }

        return builder.build();
    }
}
