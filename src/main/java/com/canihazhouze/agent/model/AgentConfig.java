package com.canihazhouze.agent.model;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Generation options plus the multi-turn settings of an agent.
 * The generation options are opaque to the engine and go straight to the chat model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfig {

    /** Deployment name passed to the chat model */
    @Builder.Default
    private String model = "gpt-41-mini";

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private double topP = 1.0;

    @Builder.Default
    private int maxTokens = 2000;

    @Builder.Default
    private double frequencyPenalty = 0.0;

    @Builder.Default
    private double presencePenalty = 0.0;

    @Min(value = 1, message = "maxTurns must be at least 1")
    @Builder.Default
    private int maxTurns = 10;

    @Builder.Default
    private boolean enableMultiTurn = true;

    /** Goal text checked by the goal evaluator after each turn; null means no goal */
    private String goalCompletionPrompt;
}
