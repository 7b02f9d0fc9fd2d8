package com.eainde.council.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the council reads from outside: the agent roster, routing thresholds and tuning knobs.
 *
 * <pre>
 * council:
 *   agents:
 *     - id: technical
 *       name: Technical Feasibility Agent
 *       persona: |
 *         You are ...
 *       tags: [technical, feasibility]
 *   thresholds:
 *     auto-approve: 0.85
 *     auto-reject: 0.15
 *     confidence: 0.80
 *     budget-review: 50000
 *     position-change: 0.15
 *   deliberation:
 *     max-rounds: 2
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "council")
public class CouncilProperties {

    private Model model = new Model();
    private List<Agent> agents = new ArrayList<>();
    private Thresholds thresholds = new Thresholds();
    private Evaluation evaluation = new Evaluation();
    private Deliberation deliberation = new Deliberation();
    private Retrieval retrieval = new Retrieval();
    private Synthesis synthesis = new Synthesis();
    private Learning learning = new Learning();
    private Routing routing = new Routing();
    private Executor executor = new Executor();

    /** Domain tag → keywords that imply it when found in an application's text. */
    private Map<String, List<String>> domainTags = new LinkedHashMap<>();

    @Data
    public static class Model {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String defaultModel = "openai/gpt-4o-mini";
        private Duration timeout = Duration.ofSeconds(120);
        private int maxRetries = 0;
        private boolean logRequests = false;
        private boolean strictJsonSchema = true;
    }

    @Data
    public static class Agent {
        private String id;
        private String name;
        private String persona;
        private List<String> tags = new ArrayList<>();
        /** Falls back to {@link Model#getDefaultModel()} when blank. */
        private String model;
        private Double temperature;
    }

    @Data
    public static class Thresholds {
        private double autoApprove = 0.85;
        private double autoReject = 0.15;
        private double confidence = 0.80;
        private double budgetReview = 50_000;
        private double positionChange = 0.15;
    }

    @Data
    public static class Evaluation {
        private double temperature = 0.5;
        private int maxAttempts = 2;
    }

    @Data
    public static class Deliberation {
        private int maxRounds = 2;
        private double temperature = 0.4;
    }

    @Data
    public static class Retrieval {
        private int maxObservations = 5;
    }

    @Data
    public static class Synthesis {
        private String model;
        private double temperature = 0.3;
    }

    @Data
    public static class Learning {
        private int minEvidence = 5;
        private int maxAgeDays = 180;
        private double reflectionTemperature = 0.5;
        private double bootstrapTemperature = 0.6;
        private int bootstrapTarget = 30;
        private int maxObservationsPerReflection = 3;
    }

    @Data
    public static class Routing {
        private List<String> sensitiveKeywords = new ArrayList<>();
    }

    @Data
    public static class Executor {
        private int inferenceThreads = 8;
    }
}
