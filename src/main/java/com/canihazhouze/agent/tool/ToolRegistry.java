package com.canihazhouze.agent.tool;

import com.canihazhouze.agent.config.ToolProperties;
import com.canihazhouze.agent.support.LogSanitizer;
import com.canihazhouze.agent.tool.impl.ServiceApiTool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tool provider backed by in-process tools.
 *
 * Spring injects every {@link AgentTool} bean; on top of those, one
 * {@link ServiceApiTool} is registered per platform service configured under
 * tools.services. Names are matched case-insensitively.
 *
 * Failures never escape {@link #invoke}: unknown tools, unparseable arguments
 * and exceptions thrown by a tool all come back as error results. Connection
 * failures are reported as {@link ToolResult.ErrorKind#TRANSIENT}.
 */
@Component
@Slf4j
public class ToolRegistry implements ToolProviderPort {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(List<AgentTool> toolBeans,
                        ToolProperties toolProperties,
                        ObjectMapper objectMapper,
                        @Qualifier("toolRestClientBuilder") RestClient.Builder restClientBuilder) {
        this.objectMapper = objectMapper;
        toolBeans.forEach(this::register);
        toolProperties.getServices().forEach((name, service) -> register(new ServiceApiTool(
                name, service, toolProperties.getHttp(), objectMapper, restClientBuilder.clone())));
        log.info("Total tools registered: {}", tools.size());
    }

    private void register(AgentTool tool) {
        tools.put(key(tool.getName()), tool);
        log.info("Registered tool: [{}]", tool.getName());
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return tools.values().stream()
                .map(ToolDescriptor::of)
                .toList();
    }

    /** Descriptors for the given names only; names with no registered tool are skipped. */
    public List<ToolDescriptor> describe(List<String> names) {
        List<ToolDescriptor> result = new ArrayList<>();
        if (names == null) {
            return result;
        }
        for (String name : names) {
            AgentTool tool = tools.get(key(name));
            if (tool != null) {
                result.add(ToolDescriptor.of(tool));
            }
        }
        return result;
    }

    @Override
    public ToolResult invoke(String name, String argumentsJson) {
        AgentTool tool = name == null ? null : tools.get(key(name));
        if (tool == null) {
            log.warn("Unknown tool requested: [{}]", LogSanitizer.clean(name));
            return ToolResult.error(ToolResult.ErrorKind.NOT_FOUND,
                    "Unknown tool '" + name + "'. Available tools: " + tools.keySet());
        }

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(argumentsJson);
        } catch (JsonProcessingException e) {
            log.warn("Tool [{}] called with unparseable arguments", tool.getName());
            return ToolResult.error(ToolResult.ErrorKind.INVOCATION_FAILED,
                    "Arguments are not a JSON object: " + e.getOriginalMessage());
        }

        log.info("Executing tool: [{}]", tool.getName());
        try {
            String result = tool.execute(arguments);
            log.debug("Tool [{}] returned {} chars", tool.getName(), result != null ? result.length() : 0);
            return ToolResult.ok(result);
        } catch (ToolExecutionException e) {
            log.warn("Tool [{}] failed{}: {}", tool.getName(), e.isTransientFailure() ? " (transient)" : "", e.getMessage());
            return ToolResult.error(e.isTransientFailure()
                    ? ToolResult.ErrorKind.TRANSIENT
                    : ToolResult.ErrorKind.INVOCATION_FAILED, e.getMessage());
        } catch (ResourceAccessException e) {
            log.warn("Tool [{}] could not reach its service: {}", tool.getName(), e.getMessage());
            return ToolResult.error(ToolResult.ErrorKind.TRANSIENT, "Tool execution failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in tool [{}]", tool.getName(), e);
            return ToolResult.error(ToolResult.ErrorKind.INVOCATION_FAILED,
                    "Tool execution failed: " + e.getMessage());
        }
    }

    public int toolCount() {
        return tools.size();
    }

    private Map<String, Object> parseArguments(String argumentsJson) throws JsonProcessingException {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed = objectMapper.readValue(argumentsJson, new TypeReference<>() {});
        return parsed != null ? parsed : Map.of();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
