package com.canihazhouze.agent.engine;

import com.canihazhouze.agent.config.EngineProperties;
import com.canihazhouze.agent.core.RunExecution;
import com.canihazhouze.agent.core.RunOutcome;
import com.canihazhouze.agent.core.TurnLoopController;
import com.canihazhouze.agent.exception.InvalidStateException;
import com.canihazhouze.agent.exception.NotFoundException;
import com.canihazhouze.agent.exception.QueueFullException;
import com.canihazhouze.agent.exception.ValidationException;
import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentInputVariable;
import com.canihazhouze.agent.model.AgentRun;
import com.canihazhouze.agent.model.AgentRunLog;
import com.canihazhouze.agent.model.RunStatus;
import com.canihazhouze.agent.model.RunSummary;
import com.canihazhouze.agent.store.RunStore;
import com.canihazhouze.agent.stream.RunEventStream;
import com.canihazhouze.agent.support.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the run state machine.
 *
 * Control operations (enqueue, pause, resume, cancel) are synchronous and
 * only set signals or queue membership; the worker holding a run observes
 * the signals at its checkpoints and makes the transitions. The one
 * exception is cancelling a run no worker holds: the control surface wins
 * the same claim a worker would use and finishes the cancel itself.
 *
 * Every status write goes through {@link #transition}, which rejects edges
 * the state machine does not allow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunLifecycleManager {

    private final RunStore store;
    private final ExecutionQueue queue;
    private final ActiveRunRegistry registry;
    private final TurnLoopController turnLoop;
    private final RunEventStream events;
    private final EngineProperties props;

    /** Handles of runs that are not terminal, created on enqueue or rebuilt on demand */
    private final Map<String, RunHandle> handles = new ConcurrentHashMap<>();

    // ─── Control operations ──────────────────────────────────────────────────

    /**
     * Create a pending run and queue it.
     *
     * @throws NotFoundException   the agent does not exist
     * @throws ValidationException a required input variable is missing or blank
     * @throws QueueFullException  no queue slot became free within the enqueue timeout
     */
    public AgentRun enqueue(String agentId, Map<String, String> inputValues, String owner) {
        Agent agent = store.findAgent(agentId).orElseThrow(() -> NotFoundException.agent(agentId));
        Map<String, String> inputs = inputValues != null ? new HashMap<>(inputValues) : new HashMap<>();
        validateInputs(agent, inputs);

        if (!queue.tryReserve(props.getEnqueueTimeout())) {
            throw new QueueFullException(queue.capacity());
        }

        AgentRun run;
        try {
            List<AgentRunLog> logs = new ArrayList<>();
            logs.add(AgentRunLog.builder().message("Run queued").build());
            run = store.createRun(AgentRun.builder()
                    .agentId(agentId)
                    .owner(owner != null ? owner : agent.getOwner())
                    .inputValues(inputs)
                    .status(RunStatus.PENDING)
                    .maxTurns(agent.getConfig().getMaxTurns())
                    .goal(agent.getConfig().getGoalCompletionPrompt())
                    .logs(logs)
                    .build());
        } catch (RuntimeException e) {
            queue.releaseReservation();
            throw e;
        }

        RunHandle handle = new RunHandle(run.getId(), agentId, run.getMaxTurns(), RunStatus.PENDING);
        handles.put(run.getId(), handle);
        events.statusChanged(run.getId(), agentId, RunStatus.PENDING);
        queue.submit(handle);

        log.info("Run queued [runId={}, agentId={}, queueDepth={}]", run.getId(), agentId, queue.size());
        return run;
    }

    public AgentRun enqueue(String agentId, Map<String, String> inputValues) {
        return enqueue(agentId, inputValues, null);
    }

    /**
     * Ask a run to pause at its next turn boundary. A paused run that was
     * resumed but not yet picked up by a worker is taken out of the queue again.
     */
    public RunStatus pause(String runId) {
        RunHandle handle = resolve(runId, "pause");
        synchronized (handle) {
            RunStatus status = handle.getStatus();
            if (status.isTerminal()) {
                throw new InvalidStateException(runId, status, "pause");
            }
            if (status == RunStatus.CANCELLING || handle.isCancelRequested()) {
                log.debug("Pause ignored, cancel already requested [runId={}]", runId);
                return status;
            }
            if (status == RunStatus.PAUSED) {
                if (handle.isQueued() && !queue.withdraw(handle)) {
                    // a worker took it between the check and the withdraw
                    handle.setPauseRequested(true);
                }
                return status;
            }
            if (!handle.isPauseRequested()) {
                handle.setPauseRequested(true);
                log.info("Pause requested [runId={}, agentId={}]", runId, handle.getAgentId());
            }
            return status;
        }
    }

    /**
     * Resume a paused run by queueing it again at the same turn number, or
     * withdraw a pause that has not been observed yet.
     *
     * @throws QueueFullException the run stays paused
     */
    public RunStatus resume(String runId) {
        RunHandle handle = resolve(runId, "resume");
        synchronized (handle) {
            RunStatus status = handle.getStatus();
            if (status.isTerminal() || status == RunStatus.CANCELLING || handle.isCancelRequested()) {
                throw new InvalidStateException(runId, status, "resume");
            }
            if (handle.isPauseRequested()) {
                handle.setPauseRequested(false);
                log.info("Pending pause withdrawn [runId={}, agentId={}]", runId, handle.getAgentId());
                return status;
            }
            if (status == RunStatus.PAUSED && !handle.isQueued()) {
                if (!queue.tryReserve(props.getEnqueueTimeout())) {
                    throw new QueueFullException(queue.capacity());
                }
                queue.submit(handle);
                log.info("Run resumed, queued at turn {} [runId={}, agentId={}]",
                        handle.getTurnCount() + 1, runId, handle.getAgentId());
            }
            return status;
        }
    }

    /**
     * Cancel a run. Held by a worker: the worker stops at its next checkpoint.
     * Not held: the run goes to cancelled right here without ever running.
     */
    public RunStatus cancel(String runId) {
        RunHandle handle = resolve(runId, "cancel");
        synchronized (handle) {
            RunStatus status = handle.getStatus();
            if (status.isTerminal()) {
                throw new InvalidStateException(runId, status, "cancel");
            }
            if (handle.isCancelRequested()) {
                return status;
            }
            handle.setCancelRequested(true);
            log.info("Cancel requested [runId={}, agentId={}]", runId, handle.getAgentId());

            if (!registry.tryClaim(handle, ActiveRunRegistry.CONTROL_OWNER)) {
                return status;
            }
            try {
                if (handle.isQueued()) {
                    queue.withdraw(handle);
                }
                AgentRun run = store.findRun(runId).orElseThrow(() -> NotFoundException.run(runId));
                if (run.getStatus().isTerminal()) {
                    handles.remove(runId);
                    return run.getStatus();
                }
                cancelUnstarted(run, handle);
                return handle.getStatus();
            } finally {
                registry.release(runId, ActiveRunRegistry.CONTROL_OWNER);
            }
        }
    }

    // ─── Queries ─────────────────────────────────────────────────────────────

    public List<RunSummary> listActive() {
        return registry.snapshot();
    }

    public AgentRun getRun(String runId) {
        return store.findRun(runId).orElseThrow(() -> NotFoundException.run(runId));
    }

    public AgentRun getRun(String agentId, String runId) {
        AgentRun run = getRun(runId);
        if (!run.getAgentId().equals(agentId)) {
            throw NotFoundException.run(runId);
        }
        return run;
    }

    public List<AgentRun> listRuns(String agentId) {
        return store.listRunsByAgent(agentId);
    }

    // ─── Worker side ─────────────────────────────────────────────────────────

    /**
     * Run a claimed handle until the turn loop returns, then settle the outcome.
     * The caller holds the registry claim as {@code owner}. Settling releases it
     * under the handle's monitor, so a resume or re-queue never sees the run
     * paused while it is still claimed.
     */
    void execute(RunHandle handle, String owner) {
        String runId = handle.getRunId();
        AgentRun run = store.findRun(runId).orElse(null);
        if (run == null) {
            log.warn("Dequeued run no longer exists [runId={}]", runId);
            handles.remove(runId);
            return;
        }
        if (run.getStatus().isTerminal()) {
            log.debug("Dequeued run already {} [runId={}]", run.getStatus().wireName(), runId);
            handles.remove(runId);
            return;
        }

        synchronized (handle) {
            if (handle.isCancelRequested()) {
                cancelUnstarted(run, handle);
                return;
            }
            if (run.getStartedAt() == null) {
                run.setStartedAt(Instant.now());
            }
            run.setPausedAt(null);
            transition(run, handle, RunStatus.RUNNING);
        }

        Agent agent = store.findAgent(run.getAgentId()).orElse(null);
        if (agent == null) {
            settle(run, handle, RunOutcome.failed("Agent " + run.getAgentId() + " no longer exists"), null, owner);
            return;
        }

        log.info("Run started [runId={}, agentId={}, agent='{}', turn={}/{}]", runId, run.getAgentId(),
                LogSanitizer.clean(agent.getName()), run.getTurnCount() + 1, run.getMaxTurns());

        RunExecution exec = new RunExecution(run, agent, handle, store, events);
        RunOutcome outcome;
        try {
            outcome = turnLoop.drive(exec);
        } catch (RuntimeException e) {
            log.error("Run failed with an unexpected error [runId={}, agentId={}]", runId, run.getAgentId(), e);
            exec.log(AgentRunLog.ERROR, "Agent execution failed: " + e.getMessage());
            outcome = RunOutcome.failed(e.getMessage());
        }
        settle(run, handle, outcome, exec, owner);
    }

    private void settle(AgentRun run, RunHandle handle, RunOutcome outcome, RunExecution exec, String owner) {
        synchronized (handle) {
            boolean requeue = false;
            if (exec != null) {
                run.setRunningMillis(exec.elapsedRunningMillis());
            }

            if (handle.isCancelRequested()) {
                addLog(run, AgentRunLog.INFO, "Agent execution cancelled");
                transition(run, handle, RunStatus.CANCELLING);
                run.setResult(RunOutcome.cancelled().reason());
                run.setCompletedAt(Instant.now());
                transition(run, handle, RunStatus.CANCELLED);
            } else {
                switch (outcome.kind()) {
                    case PAUSED -> {
                        run.setPausedAt(Instant.now());
                        transition(run, handle, RunStatus.PAUSED);
                        if (handle.isPauseRequested()) {
                            handle.setPauseRequested(false);
                        } else {
                            requeue = true;
                        }
                    }
                    case COMPLETED -> {
                        run.setResult(outcome.reason());
                        run.setCompletedAt(Instant.now());
                        addLog(run, AgentRunLog.INFO, "Agent completed after " + run.getTurnCount() + " turns"
                                + (run.isGoalAchieved() ? " - goal achieved" : ""));
                        transition(run, handle, RunStatus.COMPLETED);
                    }
                    case FAILED, CANCELLED -> {
                        run.setError(outcome.reason());
                        run.setCompletedAt(Instant.now());
                        transition(run, handle, RunStatus.FAILED);
                    }
                }
            }

            if (run.getStatus().isTerminal()) {
                handles.remove(run.getId());
            }
            registry.release(run.getId(), owner);
            if (requeue) {
                requeueAfterWithdrawnPause(run, handle);
            }
            log.info("Run settled as {} [runId={}, agentId={}, turns={}, tokens={}]", run.getStatus().wireName(),
                    run.getId(), run.getAgentId(), run.getTurnCount(),
                    run.getPromptTokens() + run.getCompletionTokens());
        }
    }

    // Resume arrived after the loop had already decided to pause
    private void requeueAfterWithdrawnPause(AgentRun run, RunHandle handle) {
        if (queue.tryReserve(Duration.ZERO)) {
            queue.submit(handle);
            log.info("Run paused and immediately re-queued [runId={}]", run.getId());
        } else {
            addLog(run, AgentRunLog.WARNING, "Resume could not be honoured, queue is full; run stays paused");
            store.updateRun(run);
        }
    }

    private void cancelUnstarted(AgentRun run, RunHandle handle) {
        addLog(run, AgentRunLog.INFO, "Agent execution cancelled before it started");
        transition(run, handle, RunStatus.CANCELLING);
        run.setResult(RunOutcome.cancelled().reason());
        run.setCompletedAt(Instant.now());
        transition(run, handle, RunStatus.CANCELLED);
        handles.remove(run.getId());
    }

    private void transition(AgentRun run, RunHandle handle, RunStatus next) {
        RunStatus current = run.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal run transition " + current.wireName()
                    + " -> " + next.wireName() + " for run " + run.getId());
        }
        run.setStatus(next);
        store.updateRun(run);
        handle.setStatus(next);
        events.statusChanged(run.getId(), run.getAgentId(), next);
        log.debug("Run {} -> {} [runId={}]", current.wireName(), next.wireName(), run.getId());
    }

    private void addLog(AgentRun run, String level, String message) {
        AgentRunLog entry = AgentRunLog.builder().level(level).message(message).build();
        run.getLogs().add(entry);
        events.logAppended(run.getId(), run.getAgentId(), entry);
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────

    private RunHandle resolve(String runId, String action) {
        RunHandle handle = handles.get(runId);
        if (handle != null) {
            return handle;
        }
        AgentRun run = store.findRun(runId).orElseThrow(() -> NotFoundException.run(runId));
        if (run.getStatus().isTerminal()) {
            throw new InvalidStateException(runId, run.getStatus(), action);
        }
        // not in memory: the engine restarted since the run was created
        return handles.computeIfAbsent(runId, id -> RunHandle.of(run));
    }

    private void validateInputs(Agent agent, Map<String, String> inputs) {
        if (agent.getInputVariables() == null) {
            return;
        }
        for (AgentInputVariable variable : agent.getInputVariables()) {
            if (!variable.isRequired()) {
                continue;
            }
            String value = inputs.get(variable.getName());
            if (value == null || value.isBlank()) {
                throw new ValidationException("Required input variable '" + variable.getName() + "' is missing");
            }
        }
    }

    int trackedHandles() {
        return handles.size();
    }
}
