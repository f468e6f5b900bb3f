package com.canihazhouze.agent.llm;

import com.canihazhouze.agent.model.Message;
import com.canihazhouze.agent.tool.ToolDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Stand-in chat model for local runs without credentials. Selected when
 * llm.provider is "dummy" or no API key is configured.
 *
 * Replies are a pure function of the request: the n-th assistant reply of a
 * conversation is "Dummy turn n ...", no tools are ever called, and goal
 * checks are always answered "no", so multi-turn agents run to maxTurns.
 */
@Slf4j
public class DeterministicChatModel implements ChatModelPort {

    static final String GOAL_CHECK_MARKER = "'yes' or 'no'";

    @Override
    public ChatCompletion complete(List<Message> messages, GenerationOptions options, List<ToolDescriptor> tools) {
        if (isGoalCheck(messages)) {
            return ChatCompletion.builder().content("no").build();
        }
        long previousReplies = messages.stream()
                .filter(m -> m.getRole() == Message.Role.assistant)
                .count();
        String content = "Dummy turn " + (previousReplies + 1) + ": no chat model is configured, nothing was evaluated.";
        log.debug("Deterministic reply for {} message(s)", messages.size());
        return ChatCompletion.builder().content(content).build();
    }

    private static boolean isGoalCheck(List<Message> messages) {
        if (messages.isEmpty()) {
            return false;
        }
        Message last = messages.get(messages.size() - 1);
        return last.getRole() == Message.Role.user
                && last.getContent() != null
                && last.getContent().contains(GOAL_CHECK_MARKER);
    }
}
