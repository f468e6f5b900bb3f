package com.canihazhouze.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    /** 1-based position in the run's history */
    private int turnNumber;

    private Message.Role role;

    private String content;

    /** Only on tool-role turns */
    private List<ToolCall> toolCalls;

    private String toolCallId;

    private String toolName;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
