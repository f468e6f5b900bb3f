package com.canihazhouze.agent.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tool invocation the model asked for. The id is assigned by the model and
 * must be echoed back with the result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRequest {

    private String id;

    private String name;

    /** JSON object as a string */
    private String arguments;
}
