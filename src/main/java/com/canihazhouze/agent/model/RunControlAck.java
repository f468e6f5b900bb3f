package com.canihazhouze.agent.model;

/**
 * Response body of pause, resume and cancel. {@code status} is the run's
 * status when the signal was accepted, not the status it will end up in.
 */
public record RunControlAck(String runId, String action, RunStatus status) {}
