package com.canihazhouze.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tool invocation recorded on a tool-role turn: what the assistant asked for
 * and what came back. Failures are kept as the result text with {@code error} set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    private String id;

    private String name;

    /** Arguments exactly as the model produced them (JSON) */
    private String arguments;

    private String result;

    private boolean error;
}
