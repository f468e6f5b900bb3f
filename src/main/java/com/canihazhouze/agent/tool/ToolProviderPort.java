package com.canihazhouze.agent.tool;

import java.util.List;

/**
 * Boundary to whatever executes tools. The engine only lists tools and
 * invokes them by name; transport and discovery belong to the implementation.
 */
public interface ToolProviderPort {

    List<ToolDescriptor> listTools();

    /**
     * Invoke a tool. Never throws for tool-level failures.
     *
     * @param argumentsJson JSON object exactly as the model produced it
     */
    ToolResult invoke(String name, String argumentsJson);
}
