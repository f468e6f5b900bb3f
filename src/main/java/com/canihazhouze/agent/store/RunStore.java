package com.canihazhouze.agent.store;

import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentRun;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of agents and their runs.
 *
 * Implementations assign ids on create and return the stored state. Callers
 * must treat returned objects as snapshots: {@link #updateRun} is the only way
 * a change to a run becomes visible to other readers.
 */
public interface RunStore {

    Agent createAgent(Agent agent);

    Optional<Agent> findAgent(String agentId);

    List<Agent> listAgents();

    List<Agent> listAgentsByOwner(String owner);

    Agent updateAgent(Agent agent);

    /** @return false if no agent had that id */
    boolean deleteAgent(String agentId);

    AgentRun createRun(AgentRun run);

    Optional<AgentRun> findRun(String runId);

    /** Newest first */
    List<AgentRun> listRunsByAgent(String agentId);

    AgentRun updateRun(AgentRun run);
}
