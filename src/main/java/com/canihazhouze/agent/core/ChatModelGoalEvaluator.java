package com.canihazhouze.agent.core;

import com.canihazhouze.agent.exception.AgentException;
import com.canihazhouze.agent.llm.ChatCompletion;
import com.canihazhouze.agent.llm.ChatModelPort;
import com.canihazhouze.agent.llm.GenerationOptions;
import com.canihazhouze.agent.model.ConversationTurn;
import com.canihazhouze.agent.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Asks the chat model for a yes/no verdict on the goal, given the transcript.
 *
 * Fails closed: only an answer whose first word is "yes" counts, and any
 * error after the resilient client's retries is reported as "not achieved".
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatModelGoalEvaluator implements GoalEvaluator {

    private static final Pattern FIRST_WORD = Pattern.compile("^\\W*(\\w+)");

    private final ChatModelPort chatModel;

    @Override
    public GoalVerdict evaluate(String goal, List<ConversationTurn> history, GenerationOptions options) {
        List<Message> messages = List.of(
                Message.builder()
                        .role(Message.Role.system)
                        .content("You are evaluating if a goal has been achieved. The goal is: " + goal)
                        .build(),
                Message.builder()
                        .role(Message.Role.user)
                        .content("Based on the following conversation, has the goal been achieved? "
                                + "Answer only 'yes' or 'no'.\n\nConversation:\n" + transcript(history))
                        .build());

        try {
            ChatCompletion completion = chatModel.complete(messages, options, List.of());
            String answer = completion.getContent();
            boolean achieved = isYes(answer);
            log.debug("Goal check answered '{}' -> achieved={}", answer, achieved);
            return GoalVerdict.answered(achieved, answer,
                    completion.getPromptTokens(), completion.getCompletionTokens());
        } catch (AgentException e) {
            log.warn("Goal check failed, assuming not achieved: {}", e.getMessage());
            return GoalVerdict.evaluationFailed(e.getMessage());
        }
    }

    static boolean isYes(String answer) {
        if (answer == null) {
            return false;
        }
        Matcher m = FIRST_WORD.matcher(answer.trim());
        return m.find() && m.group(1).toLowerCase(Locale.ROOT).equals("yes");
    }

    private String transcript(List<ConversationTurn> history) {
        return history.stream()
                .map(t -> t.getRole().name() + ": " + (t.getContent() != null ? t.getContent() : ""))
                .collect(Collectors.joining("\n"));
    }
}
