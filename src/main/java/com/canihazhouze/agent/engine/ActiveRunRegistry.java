package com.canihazhouze.agent.engine;

import com.canihazhouze.agent.model.RunSummary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Who currently owns which run.
 *
 * Claiming is a test-and-set on the run id: exactly one of the competing
 * owners wins, the others drop the run. Workers claim before executing; the
 * control surface claims with {@link #CONTROL_OWNER} before it cancels a run
 * no worker holds. Whoever holds the claim is the only writer of the run.
 */
@Component
public class ActiveRunRegistry {

    public static final String CONTROL_OWNER = "control";

    private final ConcurrentHashMap<String, Claim> claims = new ConcurrentHashMap<>();

    record Claim(RunHandle handle, String owner, Instant claimedAt) {}

    public boolean tryClaim(RunHandle handle, String owner) {
        return claims.putIfAbsent(handle.getRunId(), new Claim(handle, owner, Instant.now())) == null;
    }

    /** Releases the claim only if {@code owner} still holds it. */
    public void release(String runId, String owner) {
        claims.computeIfPresent(runId, (id, claim) -> claim.owner().equals(owner) ? null : claim);
    }

    public boolean isClaimed(String runId) {
        return claims.containsKey(runId);
    }

    /**
     * Runs held by workers, oldest claim first. Reads the map without blocking
     * workers, so the view may be a few milliseconds stale.
     */
    public List<RunSummary> snapshot() {
        return claims.values().stream()
                .filter(claim -> !CONTROL_OWNER.equals(claim.owner()))
                .sorted(Comparator.comparing(Claim::claimedAt))
                .map(claim -> {
                    RunHandle h = claim.handle();
                    return new RunSummary(h.getRunId(), h.getAgentId(), h.getStatus(), h.getTurnCount(),
                            h.getMaxTurns(), claim.owner(), claim.claimedAt(),
                            h.isPauseRequested(), h.isCancelRequested());
                })
                .toList();
    }

    /** Asks every held run to stop at its next turn boundary. Used on shutdown. */
    public int requestPauseAll() {
        claims.values().stream()
                .filter(claim -> !CONTROL_OWNER.equals(claim.owner()))
                .forEach(claim -> claim.handle().setPauseRequested(true));
        return claims.size();
    }
}
