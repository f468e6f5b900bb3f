package com.canihazhouze.agent.core;

import com.canihazhouze.agent.llm.GenerationOptions;
import com.canihazhouze.agent.model.ConversationTurn;

import java.util.List;

public interface GoalEvaluator {

    /**
     * Decide whether the goal is satisfied by the conversation so far.
     * Must not throw: a check that cannot be made returns a failed verdict.
     */
    GoalVerdict evaluate(String goal, List<ConversationTurn> history, GenerationOptions options);
}
