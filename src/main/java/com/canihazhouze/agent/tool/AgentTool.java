package com.canihazhouze.agent.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows how to invoke the tool.
 *
 * A tool that cannot do its job throws {@link ToolExecutionException}. The
 * registry turns that into an error result recorded on the tool turn, so the
 * run keeps going and the model can try another approach.
 */
public interface AgentTool {

    /** Name the model uses to invoke this tool, e.g. LedgerAPI */
    String getName();

    /**
     * What the tool does. This is the main signal the model uses to decide
     * when to call it.
     */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters */
    Map<String, Object> getInputSchema();

    /**
     * Execute the tool and return the observation fed back to the model.
     *
     * @throws ToolExecutionException when the call fails
     */
    String execute(Map<String, Object> arguments);
}
