package com.canihazhouze.agent.store;

import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * MongoDB-backed run store. Agents live in "agents", runs in "agent-runs".
 * Whole-document saves are safe because each run has a single writer at a time.
 */
@Component
@ConditionalOnProperty(name = "agent.store.type", havingValue = "mongo", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MongoRunStore implements RunStore {

    private final AgentRepository agentRepository;
    private final AgentRunRepository runRepository;

    @Override
    public Agent createAgent(Agent agent) {
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        agent.setId(id);
        agent.setAgentId(id);
        agent.setCreatedAt(now);
        agent.setUpdatedAt(now);
        Agent saved = agentRepository.save(agent);
        log.debug("Created agent [agentId={}]", id);
        return saved;
    }

    @Override
    public Optional<Agent> findAgent(String agentId) {
        return agentRepository.findById(agentId);
    }

    @Override
    public List<Agent> listAgents() {
        return agentRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    @Override
    public List<Agent> listAgentsByOwner(String owner) {
        return agentRepository.findByOwnerOrderByCreatedAtDesc(owner);
    }

    @Override
    public Agent updateAgent(Agent agent) {
        agent.setUpdatedAt(Instant.now());
        return agentRepository.save(agent);
    }

    @Override
    public boolean deleteAgent(String agentId) {
        if (!agentRepository.existsById(agentId)) {
            return false;
        }
        agentRepository.deleteById(agentId);
        return true;
    }

    @Override
    public AgentRun createRun(AgentRun run) {
        run.setId(UUID.randomUUID().toString());
        Instant now = Instant.now();
        run.setCreatedAt(now);
        run.setLastUpdated(now);
        return runRepository.save(run);
    }

    @Override
    public Optional<AgentRun> findRun(String runId) {
        return runRepository.findById(runId);
    }

    @Override
    public List<AgentRun> listRunsByAgent(String agentId) {
        return runRepository.findByAgentIdOrderByCreatedAtDesc(agentId);
    }

    @Override
    public AgentRun updateRun(AgentRun run) {
        run.setLastUpdated(Instant.now());
        return runRepository.save(run);
    }
}
