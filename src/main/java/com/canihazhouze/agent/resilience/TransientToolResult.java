package com.canihazhouze.agent.resilience;

import com.canihazhouze.agent.tool.ToolResult;

import java.util.function.Predicate;

/**
 * Retry-on-result predicate for tool calls: only transient errors are tried
 * again. Referenced by class name from application.yml.
 */
public class TransientToolResult implements Predicate<Object> {

    @Override
    public boolean test(Object result) {
        return result instanceof ToolResult toolResult && toolResult.isTransient();
    }
}
