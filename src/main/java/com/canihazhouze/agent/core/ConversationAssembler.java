package com.canihazhouze.agent.core;

import com.canihazhouze.agent.llm.ToolCallRequest;
import com.canihazhouze.agent.model.ConversationTurn;
import com.canihazhouze.agent.model.Message;
import com.canihazhouze.agent.model.ToolCall;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a run's stored history into the message list sent to the model.
 *
 * Tool requests are stored only on the tool turns that answer them, so an
 * assistant message gets its tool_calls back from the tool turns that
 * directly follow it.
 */
final class ConversationAssembler {

    private ConversationAssembler() {
    }

    static List<Message> toMessages(List<ConversationTurn> history) {
        List<Message> messages = new ArrayList<>(history.size());
        for (int i = 0; i < history.size(); i++) {
            ConversationTurn turn = history.get(i);
            switch (turn.getRole()) {
                case assistant -> messages.add(Message.builder()
                        .role(Message.Role.assistant)
                        .content(turn.getContent())
                        .toolCalls(requestsAnsweredAfter(history, i))
                        .build());
                case tool -> messages.add(Message.builder()
                        .role(Message.Role.tool)
                        .content(turn.getContent())
                        .toolCallId(turn.getToolCallId())
                        .name(turn.getToolName())
                        .build());
                default -> messages.add(Message.builder()
                        .role(turn.getRole())
                        .content(turn.getContent())
                        .build());
            }
        }
        return messages;
    }

    private static List<ToolCallRequest> requestsAnsweredAfter(List<ConversationTurn> history, int assistantIndex) {
        List<ToolCallRequest> requests = new ArrayList<>();
        for (int j = assistantIndex + 1; j < history.size(); j++) {
            ConversationTurn next = history.get(j);
            if (next.getRole() != Message.Role.tool) {
                break;
            }
            if (next.getToolCalls() == null) {
                continue;
            }
            for (ToolCall call : next.getToolCalls()) {
                requests.add(ToolCallRequest.builder()
                        .id(call.getId())
                        .name(call.getName())
                        .arguments(call.getArguments())
                        .build());
            }
        }
        return requests.isEmpty() ? null : requests;
    }
}
