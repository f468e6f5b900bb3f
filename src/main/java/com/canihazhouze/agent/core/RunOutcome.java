package com.canihazhouze.agent.core;

/**
 * Why the turn loop returned. The caller maps this to the run's next status.
 */
public record RunOutcome(Kind kind, String reason) {

    public enum Kind { COMPLETED, PAUSED, CANCELLED, FAILED }

    public static RunOutcome completed(String reason) {
        return new RunOutcome(Kind.COMPLETED, reason);
    }

    public static RunOutcome paused() {
        return new RunOutcome(Kind.PAUSED, "Paused by user");
    }

    public static RunOutcome cancelled() {
        return new RunOutcome(Kind.CANCELLED, "Cancelled by user");
    }

    public static RunOutcome failed(String reason) {
        return new RunOutcome(Kind.FAILED, reason);
    }
}
