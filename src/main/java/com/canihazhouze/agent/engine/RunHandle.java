package com.canihazhouze.agent.engine;

import com.canihazhouze.agent.core.RunSignals;
import com.canihazhouze.agent.model.AgentRun;
import com.canihazhouze.agent.model.RunStatus;
import lombok.Getter;
import lombok.Setter;

/**
 * In-memory control block for a run that is not yet terminal.
 *
 * Signal flags are written by the control surface and read by the worker
 * at its checkpoints. Compound decisions (check status, then signal or
 * re-enqueue) are made while holding the handle's monitor; the worker
 * takes the same monitor when it starts the run and when it settles it.
 */
@Getter
@Setter
public class RunHandle implements RunSignals {

    private final String runId;
    private final String agentId;
    private final int maxTurns;

    private volatile RunStatus status;
    private volatile int turnCount;
    private volatile boolean pauseRequested;
    private volatile boolean cancelRequested;

    /** True while the handle sits in the execution queue */
    private volatile boolean queued;

    public RunHandle(String runId, String agentId, int maxTurns, RunStatus status) {
        this.runId = runId;
        this.agentId = agentId;
        this.maxTurns = maxTurns;
        this.status = status;
    }

    public static RunHandle of(AgentRun run) {
        RunHandle handle = new RunHandle(run.getId(), run.getAgentId(), run.getMaxTurns(), run.getStatus());
        handle.setTurnCount(run.getTurnCount());
        return handle;
    }

    @Override
    public void progress(int turnCount) {
        this.turnCount = turnCount;
    }
}
