package com.canihazhouze.agent.tool.impl;

import com.canihazhouze.agent.tool.AgentTool;
import com.canihazhouze.agent.tool.ToolExecutionException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic tool: returns its input so an agent can exercise the tool path
 * without any platform service running.
 */
@Component
public class EchoTool implements AgentTool {

    static final int MAX_REPEAT = 5;

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public String getDescription() {
        return "Returns the given message unchanged, optionally repeated up to "
                + MAX_REPEAT + " times on separate lines.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of("type", "string"),
                        "repeat", Map.of("type", "integer", "minimum", 1, "maximum", MAX_REPEAT)
                ),
                "required", List.of("message")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        if (!(arguments.get("message") instanceof String message)) {
            throw new ToolExecutionException("'message' must be a string");
        }
        int repeat = 1;
        Object raw = arguments.get("repeat");
        if (raw != null) {
            if (!(raw instanceof Number n) || n.intValue() < 1 || n.intValue() > MAX_REPEAT) {
                throw new ToolExecutionException("'repeat' must be an integer between 1 and " + MAX_REPEAT);
            }
            repeat = n.intValue();
        }
        return String.join("\n", Collections.nCopies(repeat, message));
    }
}
