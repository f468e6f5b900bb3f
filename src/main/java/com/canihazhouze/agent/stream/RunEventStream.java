package com.canihazhouze.agent.stream;

import com.canihazhouze.agent.model.AgentRunLog;
import com.canihazhouze.agent.model.ConversationTurn;
import com.canihazhouze.agent.model.RunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Live fan-out of turn, log and status events to dashboard subscribers.
 *
 * Best effort: a subscriber that cannot keep up misses events, it never
 * slows a worker down. The run document stays the source of truth; a client
 * that reconnects re-reads the run and resumes streaming.
 */
@Service
@Slf4j
public class RunEventStream {

    private final Object lock = new Object();
    private final Sinks.Many<RunEvent> liveStream = Sinks.many().multicast().directBestEffort();

    public Flux<RunEvent> events(String runId) {
        return liveStream.asFlux()
                .filter(event -> runId.equals(event.runId()));
    }

    public void turnAppended(String runId, String agentId, ConversationTurn turn) {
        publish(RunEvent.of(RunEvent.Type.turn, runId, agentId, turn));
    }

    public void logAppended(String runId, String agentId, AgentRunLog entry) {
        publish(RunEvent.of(RunEvent.Type.log, runId, agentId, entry));
    }

    public void statusChanged(String runId, String agentId, RunStatus status) {
        publish(RunEvent.of(RunEvent.Type.status, runId, agentId, status));
    }

    public int subscriberCount() {
        return liveStream.currentSubscriberCount();
    }

    // Sinks.Many rejects concurrent emitters, workers publish from several threads
    private void publish(RunEvent event) {
        Sinks.EmitResult result;
        synchronized (lock) {
            result = liveStream.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Dropped {} event for run {}: {}", event.type(), event.runId(), result);
        }
    }
}
