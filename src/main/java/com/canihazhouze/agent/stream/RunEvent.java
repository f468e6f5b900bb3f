package com.canihazhouze.agent.stream;

import java.time.Instant;

/**
 * One entry on the run event stream. The payload is the appended turn, the
 * appended log entry, or the new status.
 */
public record RunEvent(Type type, String runId, String agentId, Object payload, Instant timestamp) {

    public enum Type { turn, log, status }

    public static RunEvent of(Type type, String runId, String agentId, Object payload) {
        return new RunEvent(type, runId, agentId, payload, Instant.now());
    }
}
