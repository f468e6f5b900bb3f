package com.canihazhouze.agent.model;

import com.canihazhouze.agent.llm.ToolCallRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One message as sent to the chat model. Built from the run's
 * conversation history on every model call, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private String content;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back on later requests so the model can pair each tool result
     * with the request that produced it.
     */
    private List<ToolCallRequest> toolCalls;
}
