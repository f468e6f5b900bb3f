package com.canihazhouze.agent.core;

import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentRun;
import com.canihazhouze.agent.model.AgentRunLog;
import com.canihazhouze.agent.model.ConversationTurn;
import com.canihazhouze.agent.store.RunStore;
import com.canihazhouze.agent.stream.RunEventStream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Mutable state of one claimed run, passed through the turn loop.
 *
 * Only the worker that claimed the run holds an instance, so nothing here is
 * synchronized. Every append is published to the event stream right away;
 * {@link #checkpoint()} makes the accumulated changes durable.
 */
@Slf4j
public class RunExecution {

    @Getter
    private final AgentRun run;

    @Getter
    private final Agent agent;

    @Getter
    private final RunSignals signals;

    private final RunStore store;
    private final RunEventStream events;
    private final long claimedAtNanos;
    private final long priorRunningMillis;

    public RunExecution(AgentRun run, Agent agent, RunSignals signals, RunStore store, RunEventStream events) {
        this.run = run;
        this.agent = agent;
        this.signals = signals;
        this.store = store;
        this.events = events;
        this.claimedAtNanos = System.nanoTime();
        this.priorRunningMillis = run.getRunningMillis();
    }

    /** Numbers the turn as the next in the history, appends and publishes it. */
    public ConversationTurn appendTurn(ConversationTurn turn) {
        turn.setTurnNumber(run.nextTurnNumber());
        run.getConversationHistory().add(turn);
        events.turnAppended(run.getId(), run.getAgentId(), turn);
        return turn;
    }

    public void log(String level, String message) {
        AgentRunLog entry = AgentRunLog.builder().level(level).message(message).build();
        run.getLogs().add(entry);
        events.logAppended(run.getId(), run.getAgentId(), entry);

        switch (level) {
            case AgentRunLog.ERROR -> log.error("{} [runId={}, agentId={}]", message, run.getId(), run.getAgentId());
            case AgentRunLog.WARNING -> log.warn("{} [runId={}, agentId={}]", message, run.getId(), run.getAgentId());
            default -> log.info("{} [runId={}, agentId={}]", message, run.getId(), run.getAgentId());
        }
    }

    public void checkpoint() {
        run.setRunningMillis(elapsedRunningMillis());
        store.updateRun(run);
    }

    /** Running time across every claim of this run, including the current one. */
    public long elapsedRunningMillis() {
        return priorRunningMillis + (System.nanoTime() - claimedAtNanos) / 1_000_000;
    }
}
