package com.eainde.council.agent;

import com.eainde.council.config.CouncilProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The configured council, in declaration order. Order matters only for presentation: evaluations are
 * reported in roster order.
 */
@Slf4j
@Component
public class AgentRoster {

    private final List<AgentDescriptor> agents;

    @Autowired
    public AgentRoster(CouncilProperties properties) {
        this(toDescriptors(properties));
    }

    public AgentRoster(List<AgentDescriptor> agents) {
        if (agents == null || agents.isEmpty()) {
            throw new IllegalArgumentException("The council needs at least one configured agent");
        }
        Set<String> seen = new HashSet<>();
        for (AgentDescriptor agent : agents) {
            if (!seen.add(agent.getId())) {
                throw new IllegalArgumentException("Duplicate agent id in roster: " + agent.getId());
            }
        }
        this.agents = List.copyOf(agents);
        log.info("Council roster: {}", this.agents);
    }

    public List<AgentDescriptor> agents() {
        return agents;
    }

    public Optional<AgentDescriptor> find(String agentId) {
        return agents.stream().filter(a -> a.getId().equals(agentId)).findFirst();
    }

    public int size() {
        return agents.size();
    }

    private static List<AgentDescriptor> toDescriptors(CouncilProperties properties) {
        List<AgentDescriptor> descriptors = new ArrayList<>();
        for (CouncilProperties.Agent agent : properties.getAgents()) {
            String model = agent.getModel() != null && !agent.getModel().isBlank()
                    ? agent.getModel()
                    : properties.getModel().getDefaultModel();
            descriptors.add(AgentDescriptor.of(agent.getId(), agent.getName() != null ? agent.getName() : agent.getId())
                    .persona(agent.getPersona())
                    .tags(agent.getTags())
                    .model(model)
                    .temperature(agent.getTemperature())
                    .build());
        }
        return descriptors;
    }
}
