package com.canihazhouze.agent.store;

import com.canihazhouze.agent.model.AgentRun;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentRunRepository extends MongoRepository<AgentRun, String> {

    List<AgentRun> findByAgentIdOrderByCreatedAtDesc(String agentId);
}
