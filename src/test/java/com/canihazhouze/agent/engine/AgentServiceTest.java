package com.canihazhouze.agent.engine;

import com.canihazhouze.agent.exception.NotFoundException;
import com.canihazhouze.agent.model.Agent;
import com.canihazhouze.agent.store.RunStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentServiceTest {

    @Mock RunStore store;

    @InjectMocks
    AgentService agentService;

    @Test
    void update_keepsIdentityAndOwnerOfExistingAgent() {
        Instant created = Instant.parse("2025-01-01T00:00:00Z");
        Agent existing = Agent.builder().id("a1").agentId("a1").owner("tenant-a").createdAt(created)
                .name("old").prompt("p").build();
        when(store.findAgent("a1")).thenReturn(Optional.of(existing));
        when(store.updateAgent(any(Agent.class))).thenAnswer(inv -> inv.getArgument(0));

        agentService.update("a1", Agent.builder().id("spoofed").name("new").prompt("p2").build());

        ArgumentCaptor<Agent> saved = ArgumentCaptor.forClass(Agent.class);
        verify(store).updateAgent(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo("a1");
        assertThat(saved.getValue().getOwner()).isEqualTo("tenant-a");
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(created);
        assertThat(saved.getValue().getName()).isEqualTo("new");
    }

    @Test
    void update_unknownAgent_throwsNotFound() {
        when(store.findAgent("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> agentService.update("nope", new Agent())).isInstanceOf(NotFoundException.class);
        verify(store, never()).updateAgent(any());
    }

    @Test
    void delete_unknownAgent_throwsNotFound() {
        when(store.deleteAgent("nope")).thenReturn(false);

        assertThatThrownBy(() -> agentService.delete("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void list_withOwner_filtersByOwner() {
        when(store.listAgentsByOwner("tenant-a")).thenReturn(List.of(new Agent()));

        assertThat(agentService.list("tenant-a")).hasSize(1);
        verify(store, never()).listAgents();
    }
}
