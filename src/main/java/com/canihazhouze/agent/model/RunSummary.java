package com.canihazhouze.agent.model;

import java.time.Instant;

/**
 * Point-in-time view of a run held by a worker, as returned by the active runs listing.
 */
public record RunSummary(
        String runId,
        String agentId,
        RunStatus status,
        int turnCount,
        int maxTurns,
        String worker,
        Instant claimedAt,
        boolean pauseRequested,
        boolean cancelRequested
) {}
