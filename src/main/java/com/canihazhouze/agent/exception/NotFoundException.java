package com.canihazhouze.agent.exception;

public class NotFoundException extends AgentException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException agent(String agentId) {
        return new NotFoundException("Agent " + agentId + " not found");
    }

    public static NotFoundException run(String runId) {
        return new NotFoundException("Run " + runId + " not found");
    }
}
