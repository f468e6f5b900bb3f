package com.canihazhouze.agent.tool;

import com.canihazhouze.agent.exception.AgentException;
import lombok.Getter;

/**
 * Raised by a tool when it cannot produce a result. Transient failures
 * (service unreachable, 5xx, throttled) may succeed on a later attempt.
 */
@Getter
public class ToolExecutionException extends AgentException {

    private final boolean transientFailure;

    public ToolExecutionException(String message) {
        this(message, null, false);
    }

    public ToolExecutionException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private ToolExecutionException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static ToolExecutionException transientFailure(String message, Throwable cause) {
        return new ToolExecutionException(message, cause, true);
    }
}
