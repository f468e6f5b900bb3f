package com.canihazhouze.agent.exception;

import com.canihazhouze.agent.model.RunStatus;

/**
 * A control signal was sent to a run whose state cannot accept it.
 */
public class InvalidStateException extends AgentException {

    private final RunStatus status;

    public InvalidStateException(String runId, RunStatus status, String action) {
        super("Cannot " + action + " run " + runId + " in state " + status.wireName());
        this.status = status;
    }

    public RunStatus getStatus() {
        return status;
    }
}
