package com.canihazhouze.agent.llm;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ChatCompletion {

    /** Assistant text; may be empty when the model only requests tools */
    private String content;

    @Builder.Default
    private List<ToolCallRequest> toolCalls = List.of();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
