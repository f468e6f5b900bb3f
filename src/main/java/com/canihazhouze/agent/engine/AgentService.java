package com.canihazhouze.agent.engine;

import com.canihazhouze.agent.exception.NotFoundException;
import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.store.RunStore;
import com.canihazhouze.agent.support.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Agent definitions. Edits take effect for runs enqueued afterwards; a run
 * copies what it needs (maxTurns, goal) when it is created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentService {

    private final RunStore store;

    public Agent create(Agent agent) {
        Agent created = store.createAgent(agent);
        log.info("Agent created [agentId={}, name='{}']", created.getId(), LogSanitizer.clean(created.getName()));
        return created;
    }

    public Agent get(String agentId) {
        return store.findAgent(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
    }

    public List<Agent> list(String owner) {
        return owner == null || owner.isBlank() ? store.listAgents() : store.listAgentsByOwner(owner);
    }

    public Agent update(String agentId, Agent changes) {
        Agent existing = get(agentId);
        changes.setId(existing.getId());
        changes.setAgentId(existing.getAgentId());
        changes.setCreatedAt(existing.getCreatedAt());
        if (changes.getOwner() == null) {
            changes.setOwner(existing.getOwner());
        }
        Agent updated = store.updateAgent(changes);
        log.info("Agent updated [agentId={}]", agentId);
        return updated;
    }

    public void delete(String agentId) {
        if (!store.deleteAgent(agentId)) {
            throw NotFoundException.agent(agentId);
        }
        log.info("Agent deleted [agentId={}]", agentId);
    }
}
