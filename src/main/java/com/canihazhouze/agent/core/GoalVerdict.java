package com.canihazhouze.agent.core;

/**
 * Result of a goal check. {@code failed} means the check itself could not be
 * made; such a verdict is always "not achieved".
 */
public record GoalVerdict(boolean achieved, boolean failed, String detail, int promptTokens, int completionTokens) {

    public static GoalVerdict answered(boolean achieved, String answer, int promptTokens, int completionTokens) {
        return new GoalVerdict(achieved, false, answer, promptTokens, completionTokens);
    }

    public static GoalVerdict evaluationFailed(String reason) {
        return new GoalVerdict(false, true, reason, 0, 0);
    }
}
