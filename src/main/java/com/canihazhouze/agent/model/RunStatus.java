package com.canihazhouze.agent.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of an {@link AgentRun}.
 *
 * Wire spelling is lower-case ("pending", "running", ...) so existing dashboards
 * keep parsing run documents unchanged.
 *
 * Allowed edges:
 * <pre>
 *   pending    → running | cancelling
 *   running    → paused | cancelling | completed | failed
 *   paused     → running | cancelling
 *   cancelling → cancelled
 * </pre>
 * completed, failed and cancelled are terminal.
 */
public enum RunStatus {

    @JsonProperty("pending") PENDING,
    @JsonProperty("running") RUNNING,
    @JsonProperty("paused") PAUSED,
    @JsonProperty("cancelling") CANCELLING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED,
    @JsonProperty("cancelled") CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunStatus next) {
        return successors().contains(next);
    }

    public String wireName() {
        return name().toLowerCase();
    }

    private Set<RunStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLING);
            case RUNNING -> EnumSet.of(PAUSED, CANCELLING, COMPLETED, FAILED);
            case PAUSED -> EnumSet.of(RUNNING, CANCELLING);
            case CANCELLING -> EnumSet.of(CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(RunStatus.class);
        };
    }
}
