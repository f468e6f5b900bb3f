package com.canihazhouze.agent.api;

import com.canihazhouze.agent.engine.AgentService;
import com.canihazhouze.agent.engine.RunLifecycleManager;
import com.canihazhouze.agent.exception.DuplicateRequestException;
import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentRun;
import com.canihazhouze.agent.model.RunAccepted;
import com.canihazhouze.agent.resilience.IdempotencyService;
import com.canihazhouze.agent.support.LogSanitizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent definitions and run submission.
 *
 * POST /api/v1/agents/{id}/run-async
 *   Body: input values, e.g. {"customerName": "alice"}
 *   Optional header: Idempotency-Key: <uuid>
 *   A repeated key within 24h returns the run the first request created.
 */
@RestController
@RequestMapping("/api/v1/agents")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentService agentService;
    private final RunLifecycleManager lifecycleManager;
    private final IdempotencyService idempotencyService;

    @GetMapping
    public List<Agent> list(@RequestParam(value = "owner", required = false) String owner) {
        return agentService.list(owner);
    }

    @GetMapping("/{id}")
    public Agent get(@PathVariable String id) {
        return agentService.get(id);
    }

    @PostMapping
    public ResponseEntity<Agent> create(@Valid @RequestBody Agent agent) {
        Agent created = agentService.create(agent);
        return ResponseEntity.created(URI.create("/api/v1/agents/" + created.getId())).body(created);
    }

    @PutMapping("/{id}")
    public Agent update(@PathVariable String id, @Valid @RequestBody Agent agent) {
        return agentService.update(id, agent);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        agentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{agentId}/runs")
    public List<AgentRun> listRuns(@PathVariable String agentId) {
        return lifecycleManager.listRuns(agentId);
    }

    @PostMapping("/{id}/run-async")
    public ResponseEntity<RunAccepted> runAsync(
            @PathVariable String id,
            @RequestBody(required = false) Map<String, String> inputValues,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Run request [agentId={}, idempotencyKey={}]", id, LogSanitizer.clean(idempotencyKey));

        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return accepted(lifecycleManager.enqueue(id, inputValues));
        }

        Optional<String> existingRunId = idempotencyService.findRunId(id, idempotencyKey);
        if (existingRunId.isPresent()) {
            return accepted(lifecycleManager.getRun(id, existingRunId.get()));
        }
        if (!idempotencyService.claimKey(id, idempotencyKey)) {
            throw new DuplicateRequestException(idempotencyKey);
        }

        AgentRun run;
        try {
            run = lifecycleManager.enqueue(id, inputValues);
        } catch (RuntimeException e) {
            // release so the client can retry once the cause is fixed
            idempotencyService.releaseKey(id, idempotencyKey);
            throw e;
        }
        idempotencyService.storeRunId(id, idempotencyKey, run.getId());
        return accepted(run);
    }

    private ResponseEntity<RunAccepted> accepted(AgentRun run) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/runs/" + run.getAgentId() + "/" + run.getId()))
                .body(new RunAccepted(run.getId(), run.getAgentId(), run.getStatus()));
    }
}
