package com.eainde.council.agent;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Declarative description of one council member. The roster is a list of these, read from configuration;
 * dispatch, deliberation, aggregation and routing treat every descriptor the same way.
 *
 * <pre>
 * AgentDescriptor.of("budget", "Budget Reasonableness Agent")
 *          .persona("You are the Budget Reasonableness Agent ...")
 *          .tags("budget", "cost", "milestones")
 *          .model("openai/gpt-4o-mini")
 *          .build();
 * </pre>
 */
public class AgentDescriptor {

    private final String id;
    private final String name;
    private final String persona;
    private final Set<String> tags;
    private final String model;
    private final Double temperature;

    private AgentDescriptor(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.persona = builder.persona;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.model = builder.model;
        this.temperature = builder.temperature;
    }

    public static Builder of(String id, String name) {
        return new Builder(id, name);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getPersona() { return persona; }
    public Set<String> getTags() { return tags; }
    public String getModel() { return model; }
    public Double getTemperature() { return temperature; }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /** Temperature override, or the caller's default when none is configured. */
    public double temperatureOr(double fallback) {
        return temperature != null ? temperature : fallback;
    }

    @Override
    public String toString() {
        return id + " (" + name + ") model=" + model + " tags=" + tags;
    }

    public static class Builder {
        private final String id;
        private final String name;
        private String persona;
        private final Set<String> tags = new LinkedHashSet<>();
        private String model;
        private Double temperature;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder persona(String persona) {
            this.persona = persona;
            return this;
        }

        public Builder tags(String... tags) {
            return tags(List.of(tags));
        }

        /** Tags are lower-cased; they are matched against observation tags. */
        public Builder tags(List<String> tags) {
            if (tags != null) {
                tags.stream()
                        .filter(t -> t != null && !t.isBlank())
                        .map(t -> t.trim().toLowerCase(Locale.ROOT))
                        .forEach(this.tags::add);
            }
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public AgentDescriptor build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id is required for agent: " + name);
            }
            if (persona == null || persona.isBlank()) {
                throw new IllegalArgumentException("persona is required for agent: " + id);
            }
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model is required for agent: " + id);
            }
            if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
                throw new IllegalArgumentException("temperature must be within [0, 2] for agent: " + id);
            }
            return new AgentDescriptor(this);
        }
    }
}
