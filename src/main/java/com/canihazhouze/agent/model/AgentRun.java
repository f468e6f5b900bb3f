package com.canihazhouze.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One execution of an {@link Agent}.
 *
 * Collection: agent-runs
 *
 * Written only by whoever currently owns the run: the worker executing it, or
 * the control surface while it cancels a run no worker holds. History and logs
 * are append-only; once the status is terminal the document is never written again.
 */
@Document(collection = "agent-runs")
@CompoundIndexes({
    @CompoundIndex(name = "idx_agent_created", def = "{'agentId': 1, 'createdAt': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRun {

    @Id
    private String id;

    private String agentId;

    @Builder.Default
    private String entityType = "agent-run";

    private String owner;

    @Builder.Default
    private Map<String, String> inputValues = new HashMap<>();

    @Builder.Default
    private RunStatus status = RunStatus.PENDING;

    /** Completion reason, or the last assistant message of a completed run */
    private String result;

    private String error;

    @Builder.Default
    private List<AgentRunLog> logs = new ArrayList<>();

    @Builder.Default
    private List<ConversationTurn> conversationHistory = new ArrayList<>();

    private int turnCount;

    @Builder.Default
    private int maxTurns = 10;

    private String goal;

    private boolean goalAchieved;

    private int promptTokens;

    private int completionTokens;

    /** Time spent in running state across all claims, used for the run timeout */
    private long runningMillis;

    private Instant createdAt;

    private Instant startedAt;

    private Instant pausedAt;

    private Instant completedAt;

    private Instant lastUpdated;

    public void addUsage(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
    }

    public int nextTurnNumber() {
        return conversationHistory.size() + 1;
    }
}
