package com.canihazhouze.agent.exception;

/**
 * Bad input to enqueue. Raised before any run document exists.
 */
public class ValidationException extends AgentException {

    public ValidationException(String message) {
        super(message);
    }
}
