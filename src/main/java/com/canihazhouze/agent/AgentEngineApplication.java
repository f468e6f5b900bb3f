package com.canihazhouze.agent;

import com.canihazhouze.agent.config.EngineProperties;
import com.canihazhouze.agent.config.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({EngineProperties.class, ToolProperties.class})
public class AgentEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentEngineApplication.class, args);
    }
}
