package com.canihazhouze.agent.model;

/**
 * Response body for an accepted run-async request.
 */
public record RunAccepted(String runId, String agentId, RunStatus status) {}
