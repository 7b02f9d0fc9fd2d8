package com.eainde.council.config;

import com.eainde.council.gateway.CouncilObservabilityListener;
import com.eainde.council.thread.MdcAwareExecutor;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(CouncilProperties.class)
public class CouncilConfig {

    /**
     * OpenAI-compatible chat model (OpenRouter by default). Retries are left to the council, which retries
     * each agent call exactly once, so the client's own retry count stays at the configured value (0).
     */
    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel councilChatModel(CouncilProperties properties) {
        CouncilProperties.Model model = properties.getModel();
        log.info("Configuring chat model {} at {}", model.getDefaultModel(), model.getBaseUrl());
        return OpenAiChatModel.builder()
                .baseUrl(model.getBaseUrl())
                .apiKey(model.getApiKey())
                .modelName(model.getDefaultModel())
                .timeout(model.getTimeout())
                .maxRetries(model.getMaxRetries())
                .supportedCapabilities(Capability.RESPONSE_FORMAT_JSON_SCHEMA)
                .strictJsonSchema(model.isStrictJsonSchema())
                .logRequests(model.isLogRequests())
                .logResponses(model.isLogRequests())
                .listeners(List.of(new CouncilObservabilityListener()))
                .build();
    }

    /** Runs individual inference calls of a fan-out. */
    @Bean(name = "inferenceExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor inferenceExecutor(CouncilProperties properties) {
        return MdcAwareExecutor.fixed("council-inference", properties.getExecutor().getInferenceThreads());
    }

    /** Runs whole pipelines and learning jobs, kept apart so a run never waits on its own pool. */
    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor pipelineExecutor() {
        return MdcAwareExecutor.cached("council-pipeline");
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
