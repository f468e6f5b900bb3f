package com.canihazhouze.agent.exception;

/**
 * A request carrying the same idempotency key is still being processed.
 */
public class DuplicateRequestException extends AgentException {

    public DuplicateRequestException(String idempotencyKey) {
        super("A request with Idempotency-Key " + idempotencyKey + " is already in progress");
    }
}
