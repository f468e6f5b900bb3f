package com.canihazhouze.agent.store;

import com.canihazhouze.agent.model.Agent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentRepository extends MongoRepository<Agent, String> {

    List<Agent> findByOwnerOrderByCreatedAtDesc(String owner);
}
