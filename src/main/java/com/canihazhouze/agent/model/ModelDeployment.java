package com.canihazhouze.agent.model;

import java.util.List;

/**
 * A model deployment an agent can be configured with.
 */
public record ModelDeployment(String deploymentName, String displayName, String description) {

    public static final List<ModelDeployment> AVAILABLE = List.of(
            new ModelDeployment("gpt-4o", "gpt-4o",
                    "Flagship reasoning model for logic-heavy tasks, deep analytics, and code generation"),
            new ModelDeployment("gpt-4o-mini", "gpt-4o Mini",
                    "Lightweight gpt-4o for cost-sensitive use cases with reasoning capabilities"),
            new ModelDeployment("gpt-5-nano", "gpt-5 Nano",
                    "Fastest low-latency model for lightweight tasks and quick agent responses")
    );
}
