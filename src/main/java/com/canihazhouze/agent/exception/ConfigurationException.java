package com.canihazhouze.agent.exception;

/**
 * The agent definition cannot be executed as written: malformed prompt
 * template, missing agent, and similar. Never retried.
 */
public class ConfigurationException extends AgentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
