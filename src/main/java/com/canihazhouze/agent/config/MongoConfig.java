package com.canihazhouze.agent.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Mongo repositories are only wired when the Mongo run store is active.
 * With agent.store.type=memory the engine never touches Mongo.
 */
@Configuration
@ConditionalOnProperty(name = "agent.store.type", havingValue = "mongo", matchIfMissing = true)
@EnableMongoRepositories(basePackages = "com.canihazhouze.agent.store")
public class MongoConfig {
}
