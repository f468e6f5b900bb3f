package com.canihazhouze.agent.exception;

/**
 * Base type for every error the engine raises. Unchecked: callers at the HTTP
 * edge translate them in {@link GlobalExceptionHandler}; inside the worker they
 * end the run as failed.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
