package com.canihazhouze.agent.api;

import com.canihazhouze.agent.engine.AgentService;
import com.canihazhouze.agent.engine.RunLifecycleManager;
import com.canihazhouze.agent.exception.GlobalExceptionHandler;
import com.canihazhouze.agent.exception.NotFoundException;
import com.canihazhouze.agent.exception.QueueFullException;
import com.canihazhouze.agent.exception.ValidationException;
import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.model.AgentRun;
import com.canihazhouze.agent.model.RunStatus;
import com.canihazhouze.agent.resilience.IdempotencyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    @Mock AgentService agentService;
    @Mock RunLifecycleManager lifecycleManager;
    @Mock IdempotencyService idempotencyService;

    @InjectMocks
    AgentController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void runAsync_accepted_returnsRunIdAndLocation() throws Exception {
        when(lifecycleManager.enqueue(eq("agent-1"), anyMap())).thenReturn(pendingRun("run-1"));

        mockMvc.perform(post("/api/v1/agents/agent-1/run-async")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerName\":\"alice\"}"))
                .andExpect(status().isAccepted())
                .andExpect(header().string("Location", "/api/v1/runs/agent-1/run-1"))
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    void runAsync_unknownAgent_returns404() throws Exception {
        when(lifecycleManager.enqueue(eq("missing"), any())).thenThrow(NotFoundException.agent("missing"));

        mockMvc.perform(post("/api/v1/agents/missing/run-async"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Agent missing not found"));
    }

    @Test
    void runAsync_missingInput_returns400() throws Exception {
        when(lifecycleManager.enqueue(eq("agent-1"), any()))
                .thenThrow(new ValidationException("Required input variable 'customerName' is missing"));

        mockMvc.perform(post("/api/v1/agents/agent-1/run-async")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Required input variable 'customerName' is missing"));
    }

    @Test
    void runAsync_queueFull_returns503() throws Exception {
        when(lifecycleManager.enqueue(eq("agent-1"), any())).thenThrow(new QueueFullException(100));

        mockMvc.perform(post("/api/v1/agents/agent-1/run-async"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void runAsync_repeatedIdempotencyKey_returnsExistingRun() throws Exception {
        when(idempotencyService.findRunId("agent-1", "key-1")).thenReturn(Optional.of("run-1"));
        when(lifecycleManager.getRun("agent-1", "run-1")).thenReturn(pendingRun("run-1"));

        mockMvc.perform(post("/api/v1/agents/agent-1/run-async").header("Idempotency-Key", "key-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("run-1"));

        verify(lifecycleManager, never()).enqueue(any(), any());
    }

    @Test
    void runAsync_keyUsedForAnotherAgent_enqueuesFreshRun() throws Exception {
        when(idempotencyService.findRunId("agent-2", "key-1")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("agent-2", "key-1")).thenReturn(true);
        AgentRun run = pendingRun("run-5");
        run.setAgentId("agent-2");
        when(lifecycleManager.enqueue(eq("agent-2"), any())).thenReturn(run);

        mockMvc.perform(post("/api/v1/agents/agent-2/run-async").header("Idempotency-Key", "key-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("run-5"))
                .andExpect(jsonPath("$.agentId").value("agent-2"));

        verify(idempotencyService).storeRunId("agent-2", "key-1", "run-5");
        verify(lifecycleManager, never()).getRun(any(), any());
    }

    @Test
    void runAsync_keyInFlight_returns409() throws Exception {
        when(idempotencyService.findRunId("agent-1", "key-1")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("agent-1", "key-1")).thenReturn(false);

        mockMvc.perform(post("/api/v1/agents/agent-1/run-async").header("Idempotency-Key", "key-1"))
                .andExpect(status().isConflict());
    }

    @Test
    void runAsync_enqueueRejected_releasesIdempotencyKey() throws Exception {
        when(idempotencyService.findRunId("agent-1", "key-1")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("agent-1", "key-1")).thenReturn(true);
        when(lifecycleManager.enqueue(eq("agent-1"), any())).thenThrow(new QueueFullException(1));

        mockMvc.perform(post("/api/v1/agents/agent-1/run-async").header("Idempotency-Key", "key-1"))
                .andExpect(status().isServiceUnavailable());

        verify(idempotencyService).releaseKey("agent-1", "key-1");
        verify(idempotencyService, never()).storeRunId(any(), any(), any());
    }

    @Test
    void runAsync_newIdempotencyKey_storesRunId() throws Exception {
        when(idempotencyService.findRunId("agent-1", "key-1")).thenReturn(Optional.empty());
        when(idempotencyService.claimKey("agent-1", "key-1")).thenReturn(true);
        when(lifecycleManager.enqueue(eq("agent-1"), any())).thenReturn(pendingRun("run-9"));

        mockMvc.perform(post("/api/v1/agents/agent-1/run-async").header("Idempotency-Key", "key-1"))
                .andExpect(status().isAccepted());

        verify(idempotencyService).storeRunId("agent-1", "key-1", "run-9");
    }

    @Test
    void create_blankName_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"prompt\":\"Review {{customerName}}\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("name: name must not be blank"));
    }

    @Test
    void create_valid_returns201() throws Exception {
        when(agentService.create(any(Agent.class))).thenAnswer(inv -> {
            Agent agent = inv.getArgument(0);
            agent.setId("agent-1");
            return agent;
        });

        mockMvc.perform(post("/api/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Reviewer\",\"prompt\":\"Review {{customerName}}\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/v1/agents/agent-1"))
                .andExpect(jsonPath("$.config.maxTurns").value(10));
    }

    @Test
    void get_unknownAgent_returns404() throws Exception {
        when(agentService.get("missing")).thenThrow(NotFoundException.agent("missing"));

        mockMvc.perform(get("/api/v1/agents/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void delete_returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/agents/agent-1"))
                .andExpect(status().isNoContent());

        verify(agentService).delete("agent-1");
    }

    private static AgentRun pendingRun(String runId) {
        return AgentRun.builder()
                .id(runId)
                .agentId("agent-1")
                .status(RunStatus.PENDING)
                .inputValues(Map.of("customerName", "alice"))
                .build();
    }
}
