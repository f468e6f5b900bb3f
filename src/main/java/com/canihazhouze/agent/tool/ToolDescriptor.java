package com.canihazhouze.agent.tool;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the catalog publishes and the model sees for one tool: its name, a
 * description and the JSON schema of its arguments.
 */
@Value
@Builder
public class ToolDescriptor {

    String name;
    String description;
    Map<String, Object> inputSchema;

    public static ToolDescriptor of(AgentTool tool) {
        return new ToolDescriptor(tool.getName(), tool.getDescription(), tool.getInputSchema());
    }

    /** Chat-completions "function" tool entry. */
    public Map<String, Object> toFunctionSpec() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description == null ? "" : description);
        function.put("parameters", inputSchema == null ? Map.of("type", "object") : inputSchema);
        return Map.of("type", "function", "function", function);
    }
}
