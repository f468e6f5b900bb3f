package com.canihazhouze.agent.store;

import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentRun;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run store kept in process memory, for local development and tests
 * (agent.store.type=memory). Nothing survives a restart.
 *
 * Every read and write goes through a Jackson deep copy, so callers get the
 * same snapshot semantics as with Mongo: mutating a returned object changes
 * nothing until it is written back.
 */
@Component
@ConditionalOnProperty(name = "agent.store.type", havingValue = "memory")
@Slf4j
public class InMemoryRunStore implements RunStore {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, AgentRun> runs = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryRunStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        log.info("Using in-memory run store, runs are lost on restart");
    }

    @Override
    public Agent createAgent(Agent agent) {
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        Agent stored = copy(agent, Agent.class);
        stored.setId(id);
        stored.setAgentId(id);
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        agents.put(id, stored);
        return copy(stored, Agent.class);
    }

    @Override
    public Optional<Agent> findAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId)).map(a -> copy(a, Agent.class));
    }

    @Override
    public List<Agent> listAgents() {
        return agents.values().stream()
                .sorted(Comparator.comparing(Agent::getCreatedAt).reversed())
                .map(a -> copy(a, Agent.class))
                .toList();
    }

    @Override
    public List<Agent> listAgentsByOwner(String owner) {
        return agents.values().stream()
                .filter(a -> Objects.equals(owner, a.getOwner()))
                .sorted(Comparator.comparing(Agent::getCreatedAt).reversed())
                .map(a -> copy(a, Agent.class))
                .toList();
    }

    @Override
    public Agent updateAgent(Agent agent) {
        agent.setUpdatedAt(Instant.now());
        Agent stored = copy(agent, Agent.class);
        agents.put(stored.getId(), stored);
        return copy(stored, Agent.class);
    }

    @Override
    public boolean deleteAgent(String agentId) {
        return agents.remove(agentId) != null;
    }

    @Override
    public AgentRun createRun(AgentRun run) {
        AgentRun stored = copy(run, AgentRun.class);
        stored.setId(UUID.randomUUID().toString());
        Instant now = Instant.now();
        stored.setCreatedAt(now);
        stored.setLastUpdated(now);
        runs.put(stored.getId(), stored);
        return copy(stored, AgentRun.class);
    }

    @Override
    public Optional<AgentRun> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(r -> copy(r, AgentRun.class));
    }

    @Override
    public List<AgentRun> listRunsByAgent(String agentId) {
        return runs.values().stream()
                .filter(r -> Objects.equals(agentId, r.getAgentId()))
                .sorted(Comparator.comparing(AgentRun::getCreatedAt).reversed())
                .map(r -> copy(r, AgentRun.class))
                .toList();
    }

    @Override
    public AgentRun updateRun(AgentRun run) {
        run.setLastUpdated(Instant.now());
        AgentRun stored = copy(run, AgentRun.class);
        runs.put(stored.getId(), stored);
        return copy(stored, AgentRun.class);
    }

    private <T> T copy(T value, Class<T> type) {
        return objectMapper.convertValue(value, type);
    }
}
