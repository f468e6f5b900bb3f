package com.canihazhouze.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunLog {

    public static final String INFO = "info";
    public static final String WARNING = "warning";
    public static final String ERROR = "error";

    @Builder.Default
    private Instant timestamp = Instant.now();

    /** info | warning | error */
    @Builder.Default
    private String level = INFO;

    private String message;
}
