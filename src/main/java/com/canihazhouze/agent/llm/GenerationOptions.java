package com.canihazhouze.agent.llm;

import com.canihazhouze.agent.model.AgentConfig;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GenerationOptions {

    private String model;
    private double temperature;
    private double topP;
    private int maxTokens;
    private double frequencyPenalty;
    private double presencePenalty;

    public static GenerationOptions from(AgentConfig config) {
        return GenerationOptions.builder()
                .model(config.getModel())
                .temperature(config.getTemperature())
                .topP(config.getTopP())
                .maxTokens(config.getMaxTokens())
                .frequencyPenalty(config.getFrequencyPenalty())
                .presencePenalty(config.getPresencePenalty())
                .build();
    }
}
