package com.canihazhouze.agent.api;

import com.canihazhouze.agent.engine.RunLifecycleManager;
import com.canihazhouze.agent.model.AgentRun;
import com.canihazhouze.agent.model.RunControlAck;
import com.canihazhouze.agent.model.RunSummary;
import com.canihazhouze.agent.stream.RunEvent;
import com.canihazhouze.agent.stream.RunEventStream;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Run inspection and control.
 *
 * Pause, resume and cancel return as soon as the signal is recorded; the
 * run reaches the requested state when its worker next checks in.
 */
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class RunController {

    private final RunLifecycleManager lifecycleManager;
    private final RunEventStream eventStream;

    @GetMapping("/active")
    public List<RunSummary> active() {
        return lifecycleManager.listActive();
    }

    @GetMapping("/{agentId}/{runId}")
    public AgentRun get(@PathVariable String agentId, @PathVariable String runId) {
        return lifecycleManager.getRun(agentId, runId);
    }

    @PostMapping("/{agentId}/{runId}/pause")
    public RunControlAck pause(@PathVariable String agentId, @PathVariable String runId) {
        lifecycleManager.getRun(agentId, runId);
        return new RunControlAck(runId, "pause", lifecycleManager.pause(runId));
    }

    @PostMapping("/{agentId}/{runId}/resume")
    public RunControlAck resume(@PathVariable String agentId, @PathVariable String runId) {
        lifecycleManager.getRun(agentId, runId);
        return new RunControlAck(runId, "resume", lifecycleManager.resume(runId));
    }

    @PostMapping("/{agentId}/{runId}/cancel")
    public RunControlAck cancel(@PathVariable String agentId, @PathVariable String runId) {
        lifecycleManager.getRun(agentId, runId);
        return new RunControlAck(runId, "cancel", lifecycleManager.cancel(runId));
    }

    @GetMapping(value = "/{agentId}/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<RunEvent> events(@PathVariable String agentId, @PathVariable String runId) {
        lifecycleManager.getRun(agentId, runId);
        return eventStream.events(runId);
    }
}
